package fun.fengwk.msh.core.facade.search.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
class SearchTypeTest {

    @Test
    void shouldResolveWireValues() {
        assertThat(SearchType.of("image")).isEqualTo(SearchType.IMAGE);
        assertThat(SearchType.of(" News ")).isEqualTo(SearchType.NEWS);
        assertThat(SearchType.of(null)).isEqualTo(SearchType.WEB);
        assertThat(SearchType.of("")).isEqualTo(SearchType.WEB);
        assertThat(SearchType.of("maps")).isNull();
    }

    @Test
    void shouldReadIntegerParams() {
        SearchQuery query = SearchQuery.builder()
            .text("q")
            .params(Map.of("offset", 2.0, "pageno", "3", "start", "x"))
            .build();

        assertThat(query.getInteger("offset")).isEqualTo(2);
        assertThat(query.getInteger("pageno")).isEqualTo(3);
        assertThat(query.getInteger("missing")).isNull();
        assertThatThrownBy(() -> query.getInteger("start"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("start must be a number, got x");
    }

}

package fun.fengwk.msh.cli.all;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.msh")
public class SearchHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(SearchHubApplication.class, args);
    }

}

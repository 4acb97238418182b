package ai.compile;

import ai.compile.catalog.CardCatalogProvider;
import ai.compile.catalog.JsonCardCatalogProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class CompileGame {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(CompileGame.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Bean
    public CardCatalogProvider cardCatalogProvider() {
        return new JsonCardCatalogProvider();
    }
}

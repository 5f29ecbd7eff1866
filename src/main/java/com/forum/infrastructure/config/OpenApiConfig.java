package com.forum.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import org.springdoc.core.customizers.OperationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String USER_ID_HEADER = "X-User-Id";

    @Bean
    public OpenAPI forumOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Discussion Board API")
                        .version("1.0")
                        .description("""
                                Discussion listing with category, relation, author and read-status filters, \
                                and per-user read tracking. Send X-User-Id to act as a signed-in user; \
                                omit it to browse anonymously. Which scripts are listed depends on the host \
                                the request was sent to."""));
    }

    /**
     * Declares the identity header on every operation. Controllers never bind it; the auth filter reads it.
     */
    @Bean
    public OperationCustomizer userIdHeaderCustomizer() {
        return (operation, handlerMethod) -> operation.addParametersItem(new HeaderParameter()
                .name(USER_ID_HEADER)
                .required(false)
                .description("Signed-in user id; absent for anonymous requests")
                .example("1")
                .schema(new StringSchema()));
    }
}

package ru.panic.orderautomationbot.configuration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;
import ru.panic.orderautomationbot.property.FunPayProperty;

import java.io.IOException;
import java.net.HttpURLConnection;

@Configuration
public class RestTemplateConfiguration {
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder restTemplateBuilder, FunPayProperty funPayProperty) {
        return restTemplateBuilder
                .requestFactory(() -> {
                    NoRedirectRequestFactory requestFactory = new NoRedirectRequestFactory();
                    requestFactory.setConnectTimeout(funPayProperty.getConnectTimeoutMillis());
                    requestFactory.setReadTimeout(funPayProperty.getReadTimeoutMillis());
                    return requestFactory;
                })
                .build();
    }

    // session cookies and the SSO jwt are read from redirect responses, so redirects are never followed
    static class NoRedirectRequestFactory extends SimpleClientHttpRequestFactory {
        @Override
        protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
            super.prepareConnection(connection, httpMethod);
            connection.setInstanceFollowRedirects(false);
        }
    }
}

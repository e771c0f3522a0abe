package ru.oparin.newsletter.config.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Учетные данные администратора, публикующего выпуски рассылки.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "app.admin")
public class AdminProperties {

    private String username = "admin";

    private String password;
}

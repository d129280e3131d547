package com.codeops.qr;

import com.codeops.qr.config.AuthProperties;
import com.codeops.qr.config.CorsProperties;
import com.codeops.qr.config.JwtProperties;
import com.codeops.qr.config.QrProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * CodeOps-QR application entry point. Issues bearer tokens for configured users and
 * renders QR codes for authenticated callers.
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@EnableConfigurationProperties({JwtProperties.class, AuthProperties.class, QrProperties.class, CorsProperties.class})
public class QrApplication {

    public static void main(String[] args) {
        SpringApplication.run(QrApplication.class, args);
    }
}

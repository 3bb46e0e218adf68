package com.openforge.invoicemate.email;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties(EmailProperties.class)
public class EmailConfig {

    @Bean
    public EmailSender emailSender(EmailProperties properties) {
        return new SmtpEmailSender(properties);
    }

    @Bean
    public AttachmentFetcher attachmentFetcher(HttpClient httpClient, EmailProperties properties) {
        return new AttachmentFetcher(httpClient, properties.attachmentTimeout(), properties.maxAttachmentBytes());
    }
}

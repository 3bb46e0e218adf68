package com.openforge.invoicemate.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Activates Spring Data JPA auditing so that create/update timestamps on
 * BaseEntity are populated by the framework.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}

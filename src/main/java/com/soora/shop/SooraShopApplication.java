package com.soora.shop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the Soora shop API.
 *
 * System Overview:
 * - Public product catalog with filtering, sorting and pagination
 * - Customer profile and address book
 * - Order placement and order history
 * - Admin console: catalog, orders, users, dashboard and sales report
 *
 * Architecture:
 * - API Layer: REST controllers with Bean Validation
 * - Service Layer: transactional business logic, ownership checks
 * - Data Access Layer: Spring Data JPA repositories and Criteria specifications
 * - Infrastructure Layer: Micrometer metrics (CloudWatch export when enabled)
 *
 * Identity comes from the API gateway as X-User-Id / X-User-Role headers.
 *
 * @author Soora Platform Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class SooraShopApplication {

    public static void main(String[] args) {
        SpringApplication.run(SooraShopApplication.class, args);
    }
}

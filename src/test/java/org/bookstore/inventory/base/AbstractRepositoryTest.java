package org.bookstore.inventory.base;

import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * Base class for repository and persistence-level service tests.
 *
 * <p>Uses {@code @DataJpaTest} against an embedded H2 database:
 *
 * <ul>
 *   <li>Only loads JPA components (repositories, entities, EntityManager)
 *   <li>Schema is generated from the entity mappings, Flyway is not run
 *   <li>Each test runs in a transaction that is rolled back afterwards
 * </ul>
 *
 * <p>The Flyway migrations themselves are exercised against PostgreSQL by {@code
 * BookstoreServiceApplicationTest}.
 *
 * <p>Services that sit directly on repositories can be pulled in with {@code @Import}.
 */
@DataJpaTest(
    properties = {
      "spring.flyway.enabled=false",
      "spring.jpa.hibernate.ddl-auto=create-drop",
      "spring.jpa.properties.hibernate.auto_quote_keyword=true"
    })
@ActiveProfiles("test")
public abstract class AbstractRepositoryTest {}

package io.github.cyfko.fuzzycast.spring.autoconfigure;

import io.github.cyfko.fuzzycast.core.FuzzyCast;
import io.github.cyfko.fuzzycast.core.config.EnumMatchMode;
import io.github.cyfko.fuzzycast.core.config.FuzzyCastConfig;
import io.github.cyfko.fuzzycast.core.config.GroupingMode;
import io.github.cyfko.fuzzycast.core.spi.SchemaRegistry;
import io.github.cyfko.fuzzycast.spring.entities.Customer;
import io.github.cyfko.fuzzycast.spring.service.FuzzySearchService;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.Persistence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FuzzyCast auto-configuration")
class FuzzyCastAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FuzzyCastAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    static class PersistenceConfiguration {

        @Bean(destroyMethod = "close")
        EntityManagerFactory entityManagerFactory() {
            EntityManagerFactory emf = Persistence.createEntityManagerFactory("testPU");

            EntityManager em = emf.createEntityManager();
            em.getTransaction().begin();
            em.persist(new Customer("Alice", "alice@gmail.com", "gmail-pass", 120));
            em.persist(new Customer("Bob", "bob@yahoo.com", "secret", 42));
            em.persist(new Customer("Carol", "carol@gmail.com", "secret", 42));
            em.getTransaction().commit();
            em.close();

            return emf;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class TwoPersistenceUnitsConfiguration {

        @Bean(destroyMethod = "close")
        EntityManagerFactory primaryEmf() {
            return Persistence.createEntityManagerFactory("testPU");
        }

        @Bean(destroyMethod = "close")
        EntityManagerFactory secondaryEmf() {
            return Persistence.createEntityManagerFactory("testPU");
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomConfigConfiguration {

        @Bean
        FuzzyCastConfig customFuzzyCastConfig() {
            return FuzzyCastConfig.builder().enumMatchMode(EnumMatchMode.CASE_SENSITIVE).build();
        }
    }

    @Nested
    @DisplayName("Without a persistence unit")
    class WithoutPersistenceUnit {

        @Test
        @DisplayName("Should provide FuzzyCast with an empty schema registry")
        void shouldProvideEmptyRegistry() {
            contextRunner.run(context -> {
                assertThat(context).hasSingleBean(FuzzyCast.class);
                assertThat(context).hasSingleBean(SchemaRegistry.class);
                assertThat(context.getBean(SchemaRegistry.class).size()).isZero();
                assertThat(context).doesNotHaveBean(FuzzySearchService.class);
            });
        }

        @Test
        @DisplayName("Should default to case-insensitive enums and AND'ed groups")
        void shouldUseDefaults() {
            contextRunner.run(context -> {
                FuzzyCastConfig config = context.getBean(FuzzyCastConfig.class);
                assertThat(config.getEnumMatchMode()).isEqualTo(EnumMatchMode.CASE_INSENSITIVE);
                assertThat(config.getGroupingMode()).isEqualTo(GroupingMode.AND_NEW_GROUP);
            });
        }

        @Test
        @DisplayName("Should bind fuzzycast.* properties")
        void shouldBindProperties() {
            contextRunner
                    .withPropertyValues(
                            "fuzzycast.enum-match-mode=case-sensitive",
                            "fuzzycast.grouping-mode=or-into-last-group")
                    .run(context -> {
                        FuzzyCastConfig config = context.getBean(FuzzyCast.class).getConfig();
                        assertThat(config.getEnumMatchMode()).isEqualTo(EnumMatchMode.CASE_SENSITIVE);
                        assertThat(config.getGroupingMode()).isEqualTo(GroupingMode.OR_INTO_LAST_GROUP);
                    });
        }

        @Test
        @DisplayName("Should back off when the application defines its own config")
        void shouldBackOff() {
            contextRunner.withUserConfiguration(CustomConfigConfiguration.class).run(context -> {
                assertThat(context).hasSingleBean(FuzzyCastConfig.class);
                assertThat(context.getBean(FuzzyCast.class).getConfig().getEnumMatchMode())
                        .isEqualTo(EnumMatchMode.CASE_SENSITIVE);
            });
        }
    }

    @Nested
    @DisplayName("With several persistence units")
    class WithSeveralPersistenceUnits {

        @Test
        @DisplayName("Should start without schemas nor search service")
        void shouldStartWithoutSchemas() {
            contextRunner.withUserConfiguration(TwoPersistenceUnitsConfiguration.class).run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).hasSingleBean(FuzzyCast.class);
                assertThat(context.getBean(SchemaRegistry.class).size()).isZero();
                assertThat(context).doesNotHaveBean(FuzzySearchService.class);
            });
        }
    }

    @Nested
    @DisplayName("With a persistence unit")
    class WithPersistenceUnit {

        @Test
        @DisplayName("Should register the metamodel entities")
        void shouldRegisterEntities() {
            contextRunner.withUserConfiguration(PersistenceConfiguration.class).run(context -> {
                SchemaRegistry registry = context.getBean(SchemaRegistry.class);
                assertThat(registry.contains(Customer.class)).isTrue();
                assertThat(registry.require(Customer.class).fields())
                        .containsExactly("id", "name", "email", "passwordHash", "loyaltyPoints");
            });
        }

        @Test
        @DisplayName("Should search and count through the search service")
        void shouldSearchAndCount() {
            contextRunner.withUserConfiguration(PersistenceConfiguration.class).run(context -> {
                FuzzySearchService service = context.getBean(FuzzySearchService.class);

                List<Customer> gmail = service.search(Customer.class, "gmail");
                assertThat(gmail).extracting(Customer::getName).containsExactlyInAnyOrder("Alice", "Carol");

                assertThat(service.count(Customer.class, "42")).isEqualTo(2);
                assertThat(service.count(Customer.class, List.of())).isEqualTo(3);
            });
        }

        @Test
        @DisplayName("Should narrow a composed expression before running it")
        void shouldRunComposedExpression() {
            contextRunner.withUserConfiguration(PersistenceConfiguration.class).run(context -> {
                FuzzyCast fuzzyCast = context.getBean(FuzzyCast.class);
                FuzzySearchService service = context.getBean(FuzzySearchService.class);

                List<Customer> result = service.search(Customer.class,
                        fuzzyCast.compose(fuzzyCast.compose(Customer.class, "gmail"), "42"));

                assertThat(result).extracting(Customer::getName).containsExactly("Carol");
            });
        }
    }
}

package com.larpmanager.server.config;

import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.Entity;

import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.type.filter.AnnotationTypeFilter;
import org.springframework.util.ClassUtils;

import com.larpmanager.server.database.DatabaseManager;
import com.larpmanager.server.domain.BaseEntity;
import com.larpmanager.server.util.MetricsHelper;

import lombok.extern.slf4j.Slf4j;

/**
 * Database configuration.
 *
 * Exposes the single {@link DatabaseManager} of the application. The manager
 * owns its HikariCP pool and Hibernate session factory; Spring Boot's own
 * DataSource and JPA auto-configuration are not on the classpath.
 *
 * The manager is opened and closed by {@link DatabaseLifecycle}, not by the
 * bean factory.
 */
@Slf4j
@Configuration
public class DatabaseConfig {

    /**
     * Database manager bean mapping every {@link Entity} under the domain package.
     *
     * @param settings application settings
     * @param metricsHelper session and health metrics
     * @return an uninitialized manager
     */
    @Bean(destroyMethod = "")
    public DatabaseManager databaseManager(AppSettings settings, MetricsHelper metricsHelper) {
        List<Class<?>> entityClasses = scanEntities(BaseEntity.class.getPackageName());

        log.info("Configuring database manager: url={}, entities={}",
            settings.getDatabase().url(), entityClasses.size());

        return new DatabaseManager(settings, metricsHelper, entityClasses);
    }

    /**
     * Finds concrete {@link Entity} classes below a package.
     *
     * @param basePackage package to scan
     * @return the entity classes
     */
    static List<Class<?>> scanEntities(String basePackage) {
        ClassPathScanningCandidateComponentProvider scanner =
            new ClassPathScanningCandidateComponentProvider(false);
        scanner.addIncludeFilter(new AnnotationTypeFilter(Entity.class));

        List<Class<?>> entityClasses = new ArrayList<>();
        for (BeanDefinition candidate : scanner.findCandidateComponents(basePackage)) {
            entityClasses.add(ClassUtils.resolveClassName(
                candidate.getBeanClassName(), DatabaseConfig.class.getClassLoader()));
        }
        return entityClasses;
    }
}

package my.performancemanager.app.config;

import liquibase.integration.spring.SpringLiquibase;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.support.DatabaseStartupValidator;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Configuration
@EnableConfigurationProperties(DatabaseConfig.MigrationSettings.class)
public class DatabaseConfig {
	static final String DEFAULT_CHANGE_LOG = "classpath:db/changelog/db.changelog-master.yaml";
	private static final List<String> SCHEMA_DEPENDENT_BEANS = List.of(
			"entityManagerFactory",
			"jpaSharedEM_entityManagerFactory"
	);

	@Bean
	public DatabaseStartupValidator databaseStartupValidator(DataSource dataSource, MigrationSettings settings) {
		DatabaseStartupValidator validator = new DatabaseStartupValidator();
		validator.setDataSource(dataSource);
		validator.setTimeout(settings.startupTimeoutSeconds() == null ? 60 : settings.startupTimeoutSeconds());
		validator.setInterval(5);
		return validator;
	}

	@Bean
	@DependsOn("databaseStartupValidator")
	public SpringLiquibase liquibase(DataSource dataSource, MigrationSettings settings) {
		SpringLiquibase liquibase = new SpringLiquibase();
		liquibase.setDataSource(dataSource);
		liquibase.setChangeLog(settings.changeLogOrDefault());
		liquibase.setShouldRun(settings.enabled() == null || settings.enabled());
		return liquibase;
	}

	// Hibernate must not start before the schema has been migrated.
	@Bean
	public static BeanFactoryPostProcessor schemaMigrationOrdering() {
		return beanFactory -> SCHEMA_DEPENDENT_BEANS.forEach(name -> dependOnLiquibase(beanFactory, name));
	}

	private static void dependOnLiquibase(ConfigurableListableBeanFactory beanFactory, String beanName) {
		if (!beanFactory.containsBeanDefinition(beanName)) {
			return;
		}
		BeanDefinition definition = beanFactory.getBeanDefinition(beanName);
		List<String> dependsOn = new ArrayList<>();
		if (definition.getDependsOn() != null) {
			dependsOn.addAll(Arrays.asList(definition.getDependsOn()));
		}
		if (!dependsOn.contains("liquibase")) {
			dependsOn.add("liquibase");
		}
		definition.setDependsOn(dependsOn.toArray(String[]::new));
	}

	@ConfigurationProperties(prefix = "spring.liquibase")
	public record MigrationSettings(String changeLog, Boolean enabled, Integer startupTimeoutSeconds) {
		String changeLogOrDefault() {
			return changeLog == null || changeLog.isBlank() ? DEFAULT_CHANGE_LOG : changeLog;
		}
	}
}

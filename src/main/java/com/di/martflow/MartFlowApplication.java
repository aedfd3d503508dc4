package com.di.martflow;

import com.di.martflow.cli.PipelineCommandRunner;
import com.di.martflow.config.MartFlowProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
@EnableConfigurationProperties(MartFlowProperties.class)
public class MartFlowApplication {

	public static void main(String[] args) {
		// A command argument runs once without the web server and exits with the command's status
		if (PipelineCommandRunner.isCommand(args)) {
			ConfigurableApplicationContext ctx = new SpringApplicationBuilder(MartFlowApplication.class)
					.web(WebApplicationType.NONE)
					.run(args);
			System.exit(SpringApplication.exit(ctx));
		}
		SpringApplication.run(MartFlowApplication.class, args);
	}
}

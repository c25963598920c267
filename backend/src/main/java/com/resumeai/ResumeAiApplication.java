package com.resumeai;

import com.resumeai.infrastructure.config.RewriteProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * ResumeAi - evidence-anchored rewrite engine for resume bullets, summaries and sections.
 */
@SpringBootApplication
@EnableConfigurationProperties(RewriteProperties.class)
public class ResumeAiApplication {

	public static void main(String[] args) {
		SpringApplication.run(ResumeAiApplication.class, args);
	}

}

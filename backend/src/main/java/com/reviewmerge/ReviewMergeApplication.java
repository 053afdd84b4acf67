package com.reviewmerge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ReviewMerge - multi-source analysis report consolidation service.
 */
@SpringBootApplication
public class ReviewMergeApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReviewMergeApplication.class, args);
	}

}

package com.reviewmerge;

import com.reviewmerge.application.consolidation.ConsolidationAppService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ReviewMergeApplicationTest {

    @Autowired
    private ConsolidationAppService consolidationAppService;

    @Test
    void contextLoads() {
        assertThat(consolidationAppService.getMaxSources()).isEqualTo(20);
    }
}

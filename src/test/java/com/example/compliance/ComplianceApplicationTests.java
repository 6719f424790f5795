package com.example.compliance;

import com.example.compliance.config.ComplianceProperties;
import com.example.compliance.rules.RuleCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ComplianceApplicationTests {

    @Autowired
    private RuleCatalog ruleCatalog;

    @Autowired
    private ComplianceProperties properties;

    @Test
    void contextLoads() {
        assertThat(ruleCatalog.standards()).hasSize(7);
        assertThat(ruleCatalog.allRules()).hasSize(10);
        assertThat(properties.report().recommendationLimit()).isEqualTo(10);
        assertThat(properties.evaluation().parallelism()).isEqualTo(4);
    }
}

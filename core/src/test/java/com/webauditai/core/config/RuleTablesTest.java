package com.webauditai.core.config;

import com.webauditai.core.model.Severity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RuleTablesTest {

    private final RuleTables t = RuleTables.defaults();

    @Test
    void security_headers_in_declared_order() {
        assertThat(t.securityHeaders()).extracting(RuleTables.SecurityHeader::name)
                .containsExactly("content-security-policy", "strict-transport-security",
                        "x-frame-options", "x-content-type-options", "referrer-policy");
        assertEquals(3, t.securityHeaders().get(1).points());
        assertEquals(Severity.MEDIUM, t.securityHeaders().get(1).severity());
    }

    @Test
    void ai_crawler_roster() {
        assertThat(t.aiCrawlers()).hasSize(9).startsWith("GPTBot", "ChatGPT-User");
        assertThat(t.keyAiCrawlers()).containsExactly("GPTBot", "ClaudeBot", "PerplexityBot");
        assertThat(t.aiCrawlers()).containsAll(t.keyAiCrawlers());
        assertEquals("Anthropic", t.technicalCrawlers().get("ClaudeBot"));
    }

    @Test
    void schema_tables() {
        assertEquals("September 2023", t.deprecatedSchemaTypes().get("HowTo"));
        assertThat(t.restrictedSchemaTypes()).containsKey("FAQPage");
        assertThat(t.requiredSchemaProperties().get("Article")).containsExactly("headline", "author", "datePublished");
    }

    @Test
    void defaults_loaded_once() {
        assertSame(RuleTables.defaults(), RuleTables.defaults());
        assertNotSame(RuleTables.defaults(), RuleTables.load());
    }
}

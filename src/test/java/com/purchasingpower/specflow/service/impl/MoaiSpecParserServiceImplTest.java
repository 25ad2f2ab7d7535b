package com.purchasingpower.specflow.service.impl;

import com.purchasingpower.specflow.model.moai.ParsedAcceptanceCriteria;
import com.purchasingpower.specflow.model.moai.ParsedCondition;
import com.purchasingpower.specflow.model.moai.ParsedMoaiAcceptance;
import com.purchasingpower.specflow.model.moai.ParsedMoaiPlan;
import com.purchasingpower.specflow.model.moai.ParsedMoaiSpec;
import com.purchasingpower.specflow.model.moai.ParsedRequirement;
import com.purchasingpower.specflow.model.moai.ParsedTag;
import com.purchasingpower.specflow.model.moai.RequirementType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Parses the SPEC-AUTH-001 fixture documents under src/test/resources/moai.
 */
@DisplayName("MoAI SPEC Parser Service Tests")
class MoaiSpecParserServiceImplTest {

    private MoaiSpecParserServiceImpl parser;

    @BeforeEach
    void setUp() {
        parser = new MoaiSpecParserServiceImpl();
    }

    static String fixture(String name) throws IOException {
        return new ClassPathResource("moai/SPEC-AUTH-001/" + name).getContentAsString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("plan.md")
    class Plan {

        private ParsedMoaiPlan plan;

        @BeforeEach
        void parsePlan() throws IOException {
            plan = parser.parsePlan(fixture("plan.md"));
        }

        @Test
        @DisplayName("Should read frontmatter and strategy text")
        void testFrontmatterAndStrategy() {
            assertEquals("SPEC-AUTH-001", plan.getSpecId());
            assertEquals("2026-03-02", plan.getFrontmatter().getCreated());
            assertEquals(3L, plan.getFrontmatter().get("estimated_tags"));
            assertEquals("**Approach**: Incremental rollout behind a feature flag\n- Each TAG ships independently",
                    plan.getStrategy());
        }

        @Test
        @DisplayName("Should extract the TAG chain with scope, purpose and dependencies")
        void testTags() {
            assertThat(plan.getTags())
                    .extracting(ParsedTag::getId, ParsedTag::getTitle, ParsedTag::getScope, ParsedTag::getDependencies)
                    .containsExactly(
                            tuple("TAG-001", "Token Storage", "auth/token-store", List.of()),
                            tuple("TAG-002", "Login Endpoint", "auth/login", List.of("TAG-001")),
                            tuple("TAG-003", "SSO Bridge", "auth/sso", List.of("TAG-001", "TAG-002")));
            assertEquals("Persist refresh tokens securely", plan.getTags().get(0).getPurpose());
        }

        @Test
        @DisplayName("Should mark a TAG complete only when every condition is checked")
        void testCompletion() {
            ParsedTag storage = plan.getTags().get(0);
            ParsedTag login = plan.getTags().get(1);

            assertTrue(storage.isCompleted());
            assertFalse(login.isCompleted());
            assertThat(login.getConditions()).containsExactly(
                    new ParsedCondition("Password login works", true),
                    new ParsedCondition("Lockout after five failures", false),
                    new ParsedCondition("Audit log entry written", false));
        }

        @Test
        @DisplayName("Should stop collecting conditions at the end of the TAG chain")
        void testChecklistOutsideChainIgnored() {
            assertThat(plan.getTags().get(2).getConditions())
                    .extracting(ParsedCondition::text)
                    .containsExactly("SAML assertion validated");
        }

        @Test
        @DisplayName("Should close the conditions window on a non-indented line")
        void testConditionsWindowCloses() {
            String content = """
                    ## TAG Chain
                    ### TAG-001: Window
                    - **Completion Conditions**:
                      - [x] Inside
                    Closing paragraph.
                      - [ ] After the window
                    """;

            ParsedTag tag = parser.parsePlan(content).getTags().get(0);

            assertThat(tag.getConditions()).extracting(ParsedCondition::text).containsExactly("Inside");
            assertTrue(tag.isCompleted());
        }

        @Test
        @DisplayName("Should treat a TAG without conditions as incomplete and omit empty strategy")
        void testNoConditions() {
            ParsedMoaiPlan minimal = parser.parsePlan("## Strategy\n\n## TAG Chain\n### TAG-001: Bare\n");

            assertNull(minimal.getStrategy());
            assertFalse(minimal.getTags().get(0).isCompleted());
            assertTrue(minimal.getTags().get(0).getConditions().isEmpty());
            assertEquals("", minimal.getSpecId());
        }
    }

    @Nested
    @DisplayName("acceptance.md")
    class Acceptance {

        private ParsedMoaiAcceptance acceptance;

        @BeforeEach
        void parseAcceptance() throws IOException {
            acceptance = parser.parseAcceptance(fixture("acceptance.md"));
        }

        @Test
        @DisplayName("Should extract Given/When/Then with bullet continuation")
        void testGherkin() {
            ParsedAcceptanceCriteria login = acceptance.getCriteria().get(0);

            assertEquals("AC-1", login.getId());
            assertEquals("Password Login", login.getTitle());
            assertEquals("a registered user with a valid password", login.getGiven());
            assertEquals("the user submits the login form", login.getWhen());
            assertEquals("the system shall:\nIssue an access token\nIssue a refresh token", login.getThen());
        }

        @Test
        @DisplayName("Should end the Then clause at the first non-bullet line")
        void testThenEndsAtProse() {
            assertEquals("the request is rejected", acceptance.getCriteria().get(1).getThen());
        }

        @Test
        @DisplayName("Should verify a criterion only when every metric is checked")
        void testVerification() {
            assertThat(acceptance.getCriteria())
                    .extracting(ParsedAcceptanceCriteria::getId, ParsedAcceptanceCriteria::isVerified,
                            criteria -> criteria.getSuccessMetrics().size())
                    .containsExactly(tuple("AC-1", true, 2), tuple("AC-2", false, 2));
        }

        @Test
        @DisplayName("Should collect the Definition of Done")
        void testDefinitionOfDone() {
            assertThat(acceptance.getDefinitionOfDone()).containsExactly(
                    new ParsedCondition("All criteria verified", true),
                    new ParsedCondition("Security review signed off", false));
            assertEquals("SPEC-AUTH-001", acceptance.getSpecId());
        }
    }

    @Nested
    @DisplayName("spec.md")
    class Spec {

        private ParsedMoaiSpec spec;

        @BeforeEach
        void parseSpec() throws IOException {
            spec = parser.parseSpec(fixture("spec.md"));
        }

        @Test
        @DisplayName("Should number EARS requirements inside each section")
        void testRequirements() {
            assertThat(spec.getRequirements())
                    .extracting(ParsedRequirement::getId, ParsedRequirement::getEarsCategory, ParsedRequirement::getType)
                    .containsExactly(
                            tuple("FR-1.1", "Ubiquitous", RequirementType.SHALL),
                            tuple("FR-1.2", "Event-Driven", RequirementType.SHALL),
                            tuple("FR-2.1", "Unwanted", RequirementType.SHOULD),
                            tuple("NFR-1.1", "Ubiquitous", RequirementType.WILL));
        }

        @Test
        @DisplayName("Should join multi-line requirement text with spaces")
        void testMultiLineText() {
            ParsedRequirement rotate = spec.getRequirements().get(1);

            assertEquals("Token Issuance", rotate.getTitle());
            assertEquals("When a refresh token is presented, the system shall rotate it and invalidate the previous one.",
                    rotate.getText());
        }

        @Test
        @DisplayName("Should read list values from spec frontmatter")
        void testFrontmatter() {
            assertEquals("SPEC-AUTH-001", spec.getSpecId());
            assertEquals(List.of("SPEC-USER-001"), spec.getFrontmatter().getList("related_specs"));
            assertEquals("Authentication Overhaul", spec.getFrontmatter().getString("title"));
        }

        @Test
        @DisplayName("Should default the requirement type to SHALL")
        void testDefaultType() {
            assertEquals(RequirementType.SHALL, MoaiSpecParserServiceImpl.detectRequirementType("Plain statement."));
            assertEquals(RequirementType.MAY, MoaiSpecParserServiceImpl.detectRequirementType("Users may opt out."));
        }
    }

    @Test
    @DisplayName("Should return empty structures for empty input")
    void testEmptyDocuments() {
        assertTrue(parser.parsePlan("").getTags().isEmpty());
        assertTrue(parser.parseAcceptance("").getCriteria().isEmpty());
        assertTrue(parser.parseAcceptance("").getDefinitionOfDone().isEmpty());
        assertTrue(parser.parseSpec("").getRequirements().isEmpty());
        assertEquals("", parser.parseFrontmatter("").getSpecId());
    }
}

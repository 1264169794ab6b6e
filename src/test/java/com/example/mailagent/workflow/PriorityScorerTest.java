package com.example.mailagent.workflow;

import com.example.mailagent.config.MailAgentProperties;
import com.example.mailagent.domain.model.FolderCategory;
import com.example.mailagent.domain.repository.FolderCategoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PriorityScorerTest {

    private FolderCategoryRepository folderCategoryRepository;
    private PriorityScorer scorer;

    @BeforeEach
    void setUp() {
        folderCategoryRepository = mock(FolderCategoryRepository.class);
        when(folderCategoryRepository.findByUserIdOrderByNameAsc(anyString())).thenReturn(List.of());
        scorer = new PriorityScorer(new MailAgentProperties(), folderCategoryRepository);
    }

    @Test
    void testAssess_GovernmentSubdomainAndKeyword() {
        PriorityScorer.Assessment assessment = scorer.assess("user-1",
                "Finanzamt Berlin <service@berlin.finanzamt.de>", "Frist für Ihre Steuererklärung", "Bitte beachten");

        assertEquals(80, assessment.score());
        assertTrue(assessment.reasons().contains("government_domain:berlin.finanzamt.de"));
        assertTrue(assessment.reasons().contains("keyword:frist"));
    }

    @Test
    void testAssess_LookalikeDomainIsNotGovernment() {
        PriorityScorer.Assessment assessment = scorer.assess("user-1",
                "promo@notfinanzamt.de", "Hello", "Nothing to see");

        assertEquals(0, assessment.score());
        assertTrue(assessment.reasons().isEmpty());
    }

    @Test
    void testAssess_ConfiguredSenderAndCap() {
        FolderCategory family = new FolderCategory("user-1", "Family", "Label_family");
        family.setPrioritySenders("mom@example.com, school.example.org");
        when(folderCategoryRepository.findByUserIdOrderByNameAsc("user-1")).thenReturn(List.of(family));

        PriorityScorer.Assessment fromSchool = scorer.assess("user-1",
                "Office <office@school.example.org>", "Parents evening", "See you");
        PriorityScorer.Assessment everything = scorer.assess("user-1",
                "mom@example.com", "URGENT", "deadline today, frist");

        assertEquals(40, fromSchool.score());
        assertTrue(fromSchool.reasons().get(0).startsWith("user_configured_sender:"));
        assertEquals(70, everything.score());
    }

    @Test
    void testAssess_CappedAtHundred() {
        FolderCategory government = new FolderCategory("user-1", "Government", "Label_gov");
        government.setPrioritySenders("bmf.de");
        when(folderCategoryRepository.findByUserIdOrderByNameAsc("user-1")).thenReturn(List.of(government));

        PriorityScorer.Assessment assessment = scorer.assess("user-1", "post@bmf.de", "Dringend", "");

        assertEquals(100, assessment.score());
    }

    @Test
    void testCombine_TakesTheHigherScore() {
        PriorityScorer.Assessment rules = new PriorityScorer.Assessment(50, List.of("government_domain:bmf.de"));

        assertEquals(50, scorer.combine(20, rules));
        assertEquals(85, scorer.combine(85, rules));
        assertEquals(100, scorer.combine(140, rules));
        assertEquals(0, scorer.combine(-5, new PriorityScorer.Assessment(0, List.of())));
    }

    @Test
    void testDomainOf() {
        assertEquals("example.com", PriorityScorer.domainOf("Anna <Anna@Example.COM>"));
        assertEquals("bmi.de", PriorityScorer.domainOf("info@bmi.de"));
        assertNull(PriorityScorer.domainOf("no address here"));
        assertNull(PriorityScorer.domainOf(null));
    }
}

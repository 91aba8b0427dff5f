package com.example.mimimi.Domain;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class WordProviderTest {

    private final WordProvider wordProvider = new WordProvider();

    @Test
    void targetsAreNeverRepeatedWithinGame() {
        Set<Long> used = new HashSet<>();
        int available = wordProvider.targetWordIds(3).size();

        for (int i = 0; i < available; i++) {
            WordProvider.CatalogWord word = wordProvider.pickUniqueTarget(used, 3);
            assertTrue(used.add(word.getId()));
            assertTrue(word.getKeywordIds().size() >= 3);
        }

        assertThrows(IllegalStateException.class, () -> wordProvider.pickUniqueTarget(used, 3));
    }

    @Test
    void distractorsExcludeTarget() {
        Long target = wordProvider.allWordIds().get(0);

        List<Long> distractors = wordProvider.pickDistractors(target, 15);

        assertEquals(15, distractors.size());
        assertEquals(15, new HashSet<>(distractors).size());
        assertFalse(distractors.contains(target));
    }

    @Test
    void keywordsAreLimitedAndFromTheWord() {
        WordProvider.CatalogWord word = wordProvider.find(1L).orElseThrow();

        List<Long> keywords = wordProvider.shuffledKeywords(word, 2);

        assertEquals(2, keywords.size());
        assertTrue(word.getKeywordIds().containsAll(keywords));
        assertNotEquals("?", wordProvider.keywordName(keywords.get(0)));
    }

    @Test
    void catalogCoversLargestGameSettings() {
        assertTrue(wordProvider.targetWordIds(3).size() >= 20);
        assertTrue(wordProvider.allWordIds().size() >= 16);
    }
}

package org.chillsense.query;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ReferenceFinderTest {

    @Test
    void find_matchesWholeWordsCaseInsensitively() {
        String text = "DCL count INT;\nCount := count + 1;\naccounting := COUNT;";

        assertThat(ReferenceFinder.find(text, "count")).containsExactly(
                new TextSpan(0, 4, 9),
                new TextSpan(1, 0, 5),
                new TextSpan(1, 9, 14),
                new TextSpan(2, 14, 19));
    }

    @Test
    void find_underscoreIsPartOfWord() {
        assertThat(ReferenceFinder.find("count_x count", "count")).containsExactly(new TextSpan(0, 8, 13));
    }

    @Test
    void find_wordIsMatchedLiterally() {
        assertThat(ReferenceFinder.find("a.b + axb", "a.b")).containsExactly(new TextSpan(0, 0, 3));
    }

    @Test
    void find_blankWord_isEmpty() {
        assertThat(ReferenceFinder.find("DCL x INT;", " ")).isEmpty();
        assertThat(ReferenceFinder.find("DCL x INT;", null)).isEmpty();
    }

    @Test
    void find_commentsAreIncluded() {
        assertThat(ReferenceFinder.find("x := 1; -- reset x", "x")).hasSize(2);
    }
}

package com.phillippitts.speakdict.service.dictionary.word;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WordIdsTest {

    @Test
    void newIdsAreCanonicalAndDistinct() {
        String a = WordIds.newId();
        String b = WordIds.newId();

        assertThat(a).isNotEqualTo(b);
        assertThat(WordIds.canonical(a)).contains(a);
    }

    @Test
    void canonicalLowercasesAndTrims() {
        assertThat(WordIds.canonical("  A1B2C3D4-0000-4000-8000-00000000000F "))
                .contains("a1b2c3d4-0000-4000-8000-00000000000f");
    }

    @Test
    void rejectsNonUuids() {
        assertThat(WordIds.canonical(null)).isEmpty();
        assertThat(WordIds.canonical("not-a-uuid")).isEmpty();
        assertThat(WordIds.canonical("1-1-1-1-1")).isEmpty();
        assertThat(WordIds.canonical("zzzzzzzz-0000-4000-8000-000000000000")).isEmpty();
    }
}

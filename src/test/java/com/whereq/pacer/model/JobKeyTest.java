package com.whereq.pacer.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobKeyTest {

    @Test
    void normalizesCaseAndWhitespace() {
        assertThat(JobKey.of("Jane Doe")).isEqualTo(JobKey.of("jane doe"));
        assertThat(JobKey.of("  JANE \t  doe ")).isEqualTo(JobKey.of("Jane Doe"));
        assertThat(JobKey.of("Jane Doe").getValue()).isEqualTo("jane doe");
    }

    @Test
    void distinctNamesGiveDistinctKeys() {
        assertThat(JobKey.of("Jane Doe")).isNotEqualTo(JobKey.of("Jane Doey"));
        assertThat(JobKey.of("Jane Doe")).isNotEqualTo(JobKey.of("JaneDoe"));
    }

    @Test
    void rejectsBlankNames() {
        assertThatThrownBy(() -> JobKey.of(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobKey.of("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobKey.of("   ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void simpleSlugReplacesSpaces() {
        assertThat(JobKey.of("Jane Doe").artifactSlug()).isEqualTo("jane_doe");
        assertThat(JobKey.of("runner42").artifactSlug()).isEqualTo("runner42");
    }

    @Test
    void unsafeSlugIsFilesystemSafeAndUnique() {
        String traversal = JobKey.of("../../etc/passwd").artifactSlug();
        String accented = JobKey.of("Zoë O'Neil").artifactSlug();

        assertThat(traversal).matches("[a-z0-9_-]+");
        assertThat(accented).matches("[a-z0-9_-]+");

        // both map their unsafe characters to the same underscores
        assertThat(JobKey.of("a/b").artifactSlug()).isNotEqualTo(JobKey.of("a.b").artifactSlug());
        assertThat(JobKey.of("a/b").artifactSlug()).isNotEqualTo(JobKey.of("a b").artifactSlug());
    }
}

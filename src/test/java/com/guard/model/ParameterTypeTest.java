package com.guard.model;

import com.guard.exception.InvalidSpecException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ParameterTypeTest {

    @Test
    void fromTag_shouldResolveKnownTagsCaseInsensitively() {
        assertThat(ParameterType.fromTag("integer")).isEqualTo(ParameterType.INTEGER);
        assertThat(ParameterType.fromTag("Boolean")).isEqualTo(ParameterType.BOOLEAN);
        assertThat(ParameterType.ARRAY.tag()).isEqualTo("array");
    }

    @Test
    void fromTag_shouldReturnNullWhenNoTypeIsDeclared() {
        assertThat(ParameterType.fromTag(null)).isNull();
        assertThat(ParameterType.fromTag(" ")).isNull();
    }

    @Test
    void fromTag_shouldRejectUnknownTags() {
        InvalidSpecException e = assertThrows(InvalidSpecException.class, () -> ParameterType.fromTag("datetime"));
        assertThat(e.getMessage()).contains("datetime");
    }
}

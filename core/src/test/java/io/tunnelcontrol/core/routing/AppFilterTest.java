package io.tunnelcontrol.core.routing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Application filter")
class AppFilterTest {

    private static final String SELF = "io.tunnelcontrol";

    @Test
    @DisplayName("Allow-list → only listed applications captured")
    void allowList() {
        AppFilter filter = AppFilter.of(List.of("com.example.browser", "com.example.mail"), SELF);

        assertThat(filter.mode()).isEqualTo(AppFilter.Mode.ALLOW_ONLY);
        assertThat(filter.captures("com.example.browser")).isTrue();
        assertThat(filter.captures("com.example.game")).isFalse();
        assertThat(filter.captures(SELF)).isFalse();
    }

    @Test
    @DisplayName("Empty allow-list → everything but ourselves")
    void emptyAllowList() {
        AppFilter filter = AppFilter.of(List.of(), SELF);

        assertThat(filter.mode()).isEqualTo(AppFilter.Mode.DISALLOW);
        assertThat(filter.packages()).containsExactly(SELF);
        assertThat(filter.captures("com.example.game")).isTrue();
        assertThat(filter.captures(SELF)).isFalse();
    }

    @Test
    @DisplayName("Blank entries are ignored, names are trimmed")
    void blankEntries() {
        AppFilter filter = AppFilter.of(Arrays.asList(" ", null, " com.example.browser "), SELF);

        assertThat(filter.mode()).isEqualTo(AppFilter.Mode.ALLOW_ONLY);
        assertThat(filter.packages()).containsExactly("com.example.browser");
    }

    @Test
    @DisplayName("Only blank entries → treated as empty")
    void onlyBlankEntries() {
        assertThat(AppFilter.of(List.of("", "  "), SELF).mode()).isEqualTo(AppFilter.Mode.DISALLOW);
    }

    @Test
    @DisplayName("No allow-list and no self identifier → everything captured")
    void noSelf() {
        AppFilter filter = AppFilter.of(null, null);

        assertThat(filter.mode()).isEqualTo(AppFilter.Mode.DISALLOW);
        assertThat(filter.packages()).isEmpty();
        assertThat(filter.captures(SELF)).isTrue();
    }
}

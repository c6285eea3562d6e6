package io.snowkit.ringbuffer.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link HierarchicalConfig}.
 * <p>
 * Coverage:
 * - Global configuration (snowkit.properties)
 * - Buffer and work queue configuration with fallback to global
 * - System property overrides
 * - Typed getters, defaults and malformed values
 */
class HierarchicalConfigTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("ringbuffer.default-capacity");
        System.clearProperty("test.property");
    }

    // =========================================================================
    // Global
    // =========================================================================

    @Test
    void shouldReadGlobalDefaults() {
        HierarchicalConfig config = HierarchicalConfig.global();

        assertThat(config.context()).isEqualTo("global");
        assertThat(config.getInt("ringbuffer.default-capacity")).isEqualTo(1024);
        assertThat(config.getLong("workqueue.shutdown-timeout-ms", 0L)).isEqualTo(1000L);
        assertThat(config.getString("workqueue.thread-name-prefix")).isEqualTo("snowkit-work");
    }

    @Test
    void shouldThrowForMissingKey() {
        HierarchicalConfig config = HierarchicalConfig.global();

        assertThatThrownBy(() -> config.getString("no.such.key"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("no.such.key")
            .hasMessageContaining("global");
        assertThatThrownBy(() -> config.getInt("no.such.key"))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldFallBackToDefaults() {
        HierarchicalConfig config = HierarchicalConfig.global();

        assertThat(config.getString("no.such.key", "fallback")).isEqualTo("fallback");
        assertThat(config.getLong("no.such.key", 9L)).isEqualTo(9L);
    }

    // =========================================================================
    // Named levels
    // =========================================================================

    @Test
    void shouldPreferBufferSpecificValues() {
        HierarchicalConfig config = HierarchicalConfig.forBuffer("audit");

        assertThat(config.context()).isEqualTo("buffer:audit");
        assertThat(config.getInt("ringbuffer.default-capacity")).isEqualTo(64);
        assertThat(config.getString("test.audit-only")).isEqualTo("true");
        assertThat(config.getLong("workqueue.shutdown-timeout-ms", 0L)).isEqualTo(1000L);
    }

    @Test
    void shouldFallBackToGlobalForUnknownBuffer() {
        HierarchicalConfig config = HierarchicalConfig.forBuffer("frames");

        assertThat(config.getInt("ringbuffer.default-capacity")).isEqualTo(1024);
        assertThat(config.contains("test.audit-only")).isFalse();
    }

    @Test
    void shouldResolveWorkQueueConfig() {
        HierarchicalConfig config = HierarchicalConfig.forWorkQueue("ingest");

        assertThat(config.context()).isEqualTo("workqueue:ingest");
        assertThat(config.getString("workqueue.thread-name-prefix")).isEqualTo("snowkit-work");
    }

    @Test
    void shouldResolveFilesForAnyValidName() {
        assertThat(HierarchicalConfig.forBuffer("audit_log").getInt("ringbuffer.default-capacity")).isEqualTo(48);
        assertThat(HierarchicalConfig.forBuffer("frames2").getInt("ringbuffer.default-capacity")).isEqualTo(96);
        assertThat(HierarchicalConfig.forBuffer("sensorframes").getInt("ringbuffer.default-capacity")).isEqualTo(128);
        assertThat(HierarchicalConfig.forBuffer("a").getInt("ringbuffer.default-capacity")).isEqualTo(8);
    }

    @Test
    void shouldResolveHyphenatedWorkQueueNames() {
        HierarchicalConfig config = HierarchicalConfig.forWorkQueue("ingest-fast");

        assertThat(config.getString("workqueue.thread-name-prefix")).isEqualTo("ingest");
        assertThat(config.getInt("ringbuffer.default-capacity")).isEqualTo(1024);
    }

    @Test
    void shouldNotMixUpNamesSharingAPrefix() {
        assertThat(HierarchicalConfig.forBuffer("audit").getInt("ringbuffer.default-capacity")).isEqualTo(64);
        assertThat(HierarchicalConfig.forBuffer("audit_log").contains("test.audit-only")).isFalse();
    }

    @Test
    void shouldRejectNamesThatCannotNameAFile() {
        assertThatThrownBy(() -> HierarchicalConfig.forBuffer("audit.log"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bufferName may only contain");
        assertThatThrownBy(() -> HierarchicalConfig.forBuffer("../audit"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HierarchicalConfig.forWorkQueue("two words"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("queueName may only contain");
    }

    @Test
    void shouldRejectNullOrBlankNames() {
        assertThatThrownBy(() -> HierarchicalConfig.forBuffer(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("bufferName cannot be null");
        assertThatThrownBy(() -> HierarchicalConfig.forBuffer("  "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bufferName cannot be blank");
        assertThatThrownBy(() -> HierarchicalConfig.forWorkQueue(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("queueName cannot be blank");
    }

    // =========================================================================
    // Overrides and malformed values
    // =========================================================================

    @Test
    void shouldLetSystemPropertiesOverrideFiles() {
        System.setProperty("ringbuffer.default-capacity", "4096");

        assertThat(HierarchicalConfig.global().getInt("ringbuffer.default-capacity")).isEqualTo(4096);
        assertThat(HierarchicalConfig.forBuffer("audit").getInt("ringbuffer.default-capacity")).isEqualTo(4096);
    }

    @Test
    void shouldSeeSystemPropertyOnlyKeys() {
        System.setProperty("test.property", "yes");
        HierarchicalConfig config = HierarchicalConfig.global();

        assertThat(config.contains("test.property")).isTrue();
        assertThat(config.getString("test.property")).isEqualTo("yes");
    }

    @Test
    void shouldReportMalformedNumbers() {
        HierarchicalConfig config = HierarchicalConfig.forBuffer("broken");

        assertThatThrownBy(() -> config.getInt("ringbuffer.default-capacity"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Invalid int value")
            .hasMessageContaining("lots");
        assertThat(config.getLong("workqueue.shutdown-timeout-ms", 5L)).isEqualTo(5L);
    }

    @Test
    void shouldListInheritedKeys() {
        assertThat(HierarchicalConfig.forBuffer("audit").keys())
            .contains("test.audit-only", "ringbuffer.default-capacity", "workqueue.thread-name-prefix");
    }
}

package io.tunnelcontrol.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.reflect.Modifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Exception hierarchy")
class ExceptionHierarchyTest {

    @Test
    @DisplayName("Base type is abstract and unchecked")
    void base() {
        assertThat(Modifier.isAbstract(TunnelControlException.class.getModifiers())).isTrue();
        assertThat(RuntimeException.class).isAssignableFrom(TunnelControlException.class);
    }

    @Test
    @DisplayName("Every concrete exception extends the base and exposes detail()")
    void concrete() {
        Throwable cause = new IllegalStateException("root");
        TunnelControlException[] all = {
            new InvalidRequestException("bad body"),
            new SettingsException("bad port"),
            new PlatformException("no device", cause),
            new CertificateEncodingException("bad der"),
            new StorageException("disk full", cause),
            new ProxyCertificateException("HTTP 404")
        };

        for (TunnelControlException e : all) {
            assertThat(e.detail()).isEqualTo(e.getMessage()).isNotBlank();
        }
        assertThat(all[2]).hasCause(cause);
        assertThat(all[4]).hasCause(cause);
    }

    @Test
    @DisplayName("InvalidRequestException names the offending field when known")
    void field() {
        assertThat(new InvalidRequestException("x", "port").field()).isEqualTo("port");
        assertThat(new InvalidRequestException("x").field()).isNull();
    }
}

package com.duckora.connection;

import com.duckora.test.TestBase;
import com.duckora.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier2
@TestCategories.Unit
@DisplayName("OracleConnectionParameters Tests")
public class OracleConnectionParametersTest extends TestBase {

    @Test
    @DisplayName("Effective schema is the override, else the user, upper-cased")
    void effectiveSchema() {
        OracleConnectionParameters params = OracleConnectionParameters.builder().user("hr").build();

        assertThat(params.effectiveSchema()).isEqualTo("HR");
        assertThat(params.withSchema("sales").effectiveSchema()).isEqualTo("SALES");
    }

    @Test
    @DisplayName("Copies leave the original untouched")
    void copies() {
        OracleConnectionParameters params = OracleConnectionParameters.builder()
            .serviceName("ORCL").user("hr").build();
        OracleConnectionParameters readOnly = params.withReadOnly(true).withFetchSize(100);

        assertThat(params.readOnly()).isFalse();
        assertThat(params.fetchSize()).isEqualTo(OracleConnectionParameters.DEFAULT_FETCH_SIZE);
        assertThat(readOnly.readOnly()).isTrue();
        assertThat(readOnly.fetchSize()).isEqualTo(100);
        assertThat(readOnly).isNotEqualTo(params);
        assertThat(params.toBuilder().build()).isEqualTo(params);
    }

    @Test
    @DisplayName("Service takes precedence over SID")
    void serviceBeforeSid() {
        OracleConnectionParameters params = OracleConnectionParameters.builder()
            .host("db").serviceName("SVC").sid("SID1").build();

        assertThat(params.connectTarget()).isEqualTo("//db:1521/SVC");
    }

    @Test
    @DisplayName("Without service, SID or alias the target is host and port only")
    void hostOnly() {
        OracleConnectionParameters params = OracleConnectionParameters.builder().host("db").port(1600).build();
        assertThat(params.connectTarget()).isEqualTo("//db:1600");
    }

    @Test
    @DisplayName("The password is never printed")
    void toStringMasksPassword() {
        OracleConnectionParameters params = OracleConnectionParameters.builder()
            .serviceName("ORCL").user("hr").password("s3cr3t").build();

        assertThat(params.toString()).contains("hr").doesNotContain("s3cr3t");
    }
}

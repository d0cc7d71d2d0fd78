package com.elssolution.hydromonitor.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionStatusTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void written_in_lower_case() throws Exception {
        assertThat(mapper.writeValueAsString(ConnectionStatus.CONNECTED)).isEqualTo("\"connected\"");
        assertThat(mapper.writeValueAsString(ConnectionStatus.ERROR)).isEqualTo("\"error\"");
    }

    @Test
    void read_in_either_case() throws Exception {
        assertThat(mapper.readValue("\"error\"", ConnectionStatus.class)).isEqualTo(ConnectionStatus.ERROR);
        assertThat(mapper.readValue("\"CONNECTED\"", ConnectionStatus.class)).isEqualTo(ConnectionStatus.CONNECTED);
    }
}

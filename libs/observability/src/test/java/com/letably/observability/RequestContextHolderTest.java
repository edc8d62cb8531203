package com.letably.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("RequestContextHolder")
class RequestContextHolderTest {

    @AfterEach
    void cleanup() {
        RequestContextHolder.clear();
    }

    @Nested
    @DisplayName("set / get / clear")
    class Lifecycle {

        @Test
        @DisplayName("set populates MDC keys")
        void setPopulatesMdc() {
            RequestContextHolder.set(new RequestContext("corr-1", "7", "user-1", "req-1"));

            assertThat(MDC.get(RequestContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
            assertThat(MDC.get(RequestContext.MDC_AGENCY_ID)).isEqualTo("7");
            assertThat(MDC.get(RequestContext.MDC_USER_ID)).isEqualTo("user-1");
            assertThat(MDC.get(RequestContext.MDC_REQUEST_ID)).isEqualTo("req-1");
            assertThat(RequestContextHolder.get()).isPresent();
        }

        @Test
        @DisplayName("null fields are removed from MDC")
        void nullFieldsRemoved() {
            MDC.put(RequestContext.MDC_AGENCY_ID, "stale");
            RequestContextHolder.set(new RequestContext("corr-1", null, null, null));

            assertThat(MDC.get(RequestContext.MDC_AGENCY_ID)).isNull();
        }

        @Test
        @DisplayName("clear removes context and MDC keys")
        void clearRemovesEverything() {
            RequestContextHolder.set(new RequestContext("corr-1", "7", "user-1", "req-1"));
            RequestContextHolder.clear();

            assertThat(RequestContextHolder.get()).isEmpty();
            assertThat(MDC.get(RequestContext.MDC_CORRELATION_ID)).isNull();
            assertThat(MDC.get(RequestContext.MDC_AGENCY_ID)).isNull();
        }

        @Test
        @DisplayName("set rejects null")
        void rejectsNull() {
            assertThatThrownBy(() -> RequestContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("callWithContext()")
    class CallWithContext {

        @Test
        @DisplayName("restores the previous context afterwards")
        void restoresPrevious() {
            RequestContextHolder.set(new RequestContext("outer", "1", null, null));

            String seen = RequestContextHolder.callWithContext(
                    new RequestContext("inner", "2", null, null),
                    () -> MDC.get(RequestContext.MDC_AGENCY_ID));

            assertThat(seen).isEqualTo("2");
            assertThat(RequestContextHolder.get()).map(RequestContext::correlationId).contains("outer");
            assertThat(MDC.get(RequestContext.MDC_AGENCY_ID)).isEqualTo("1");
        }

        @Test
        @DisplayName("clears when there was no previous context, even on failure")
        void clearsOnFailure() {
            assertThatThrownBy(() -> RequestContextHolder.callWithContext(
                    new RequestContext("inner", "2", null, null),
                    () -> {
                        throw new IllegalStateException("boom");
                    }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(RequestContextHolder.get()).isEmpty();
            assertThat(MDC.get(RequestContext.MDC_AGENCY_ID)).isNull();
        }
    }

    @Test
    @DisplayName("RequestContext rejects a blank correlation id")
    void rejectsBlankCorrelationId() {
        assertThatThrownBy(() -> new RequestContext(" ", "1", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }
}

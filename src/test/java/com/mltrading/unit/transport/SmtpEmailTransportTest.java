package com.mltrading.unit.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.mltrading.alerting.transport.AlertEmailRenderer;
import com.mltrading.alerting.transport.EmailCredentials;
import com.mltrading.alerting.transport.SmtpEmailTransport;
import com.mltrading.config.AlertConfig;
import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertSeverity;
import com.mltrading.domain.enums.TransportFailureKind;
import com.mltrading.domain.model.Alert;
import com.mltrading.exception.AlertValidationException;
import com.mltrading.exception.TransportException;
import com.mltrading.support.MutableClock;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSenderImpl;

@ExtendWith(MockitoExtension.class)
class SmtpEmailTransportTest {

    @Mock
    private JavaMailSenderImpl mailSender;

    private AlertConfig.EmailSettings settings;
    private EmailCredentials credentials;
    private AlertEmailRenderer renderer;
    private Alert alert;

    @BeforeEach
    void setUp() {
        settings = AlertConfig.EmailSettings.builder()
                .enabled(true)
                .recipient("ops@example.com")
                .build();
        credentials = new EmailCredentials("alerts@example.com", "app-password");
        renderer = new AlertEmailRenderer(new MutableClock(Instant.parse("2026-03-02T10:00:00Z")));
        alert = Alert.builder()
                .title("Order router down")
                .message("No acknowledgements for 60s")
                .severity(AlertSeverity.HIGH)
                .category(AlertCategory.TRADING_ERRORS)
                .component("OrderRouter")
                .build();
    }

    private SmtpEmailTransport transport() {
        return new SmtpEmailTransport(settings, credentials, renderer, mailSender);
    }

    @Nested
    @DisplayName("Send")
    class Send {

        @Test
        @DisplayName("Sends a plain-text message from the sender to the recipient")
        void sendsMessage() {
            transport().send(alert);

            ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
            verify(mailSender).send(captor.capture());
            SimpleMailMessage message = captor.getValue();
            assertThat(message.getFrom()).isEqualTo("alerts@example.com");
            assertThat(message.getTo()).containsExactly("ops@example.com");
            assertThat(message.getSubject()).isEqualTo("[HIGH] MLTrading Alert: Order router down");
            assertThat(message.getText()).contains("No acknowledgements for 60s");
        }

        @Test
        @DisplayName("Missing credentials make the transport unavailable")
        void missingCredentials() {
            credentials = new EmailCredentials("", "");
            SmtpEmailTransport transport = transport();

            assertThat(transport.isAvailable()).isFalse();
            assertThatThrownBy(() -> transport.send(alert))
                    .isInstanceOfSatisfying(
                            TransportException.class,
                            e -> assertThat(e.getKind()).isEqualTo(TransportFailureKind.UNAVAILABLE));
            verify(mailSender, never()).send(any(SimpleMailMessage.class));
        }

        @Test
        @DisplayName("Authentication rejection maps to AUTHENTICATION")
        void authenticationFailure() {
            doThrow(new MailAuthenticationException("535 invalid credentials"))
                    .when(mailSender)
                    .send(any(SimpleMailMessage.class));

            assertThatThrownBy(() -> transport().send(alert))
                    .isInstanceOfSatisfying(
                            TransportException.class,
                            e -> assertThat(e.getKind()).isEqualTo(TransportFailureKind.AUTHENTICATION));
        }

        @Test
        @DisplayName("Socket timeout maps to TIMEOUT")
        void timeout() {
            doThrow(new MailSendException("send failed", new SocketTimeoutException("Read timed out")))
                    .when(mailSender)
                    .send(any(SimpleMailMessage.class));

            assertThatThrownBy(() -> transport().send(alert))
                    .isInstanceOfSatisfying(
                            TransportException.class,
                            e -> assertThat(e.getKind()).isEqualTo(TransportFailureKind.TIMEOUT));
        }

        @Test
        @DisplayName("Refused connection maps to CONNECTION")
        void connectionRefused() {
            doThrow(new MailSendException(
                            "send failed", new MessagingException("connect", new ConnectException("refused"))))
                    .when(mailSender)
                    .send(any(SimpleMailMessage.class));

            assertThatThrownBy(() -> transport().send(alert))
                    .isInstanceOfSatisfying(
                            TransportException.class,
                            e -> assertThat(e.getKind()).isEqualTo(TransportFailureKind.CONNECTION));
        }

        @Test
        @DisplayName("Unclassified server refusal maps to PROTOCOL")
        void serverRefusal() {
            doThrow(new MailSendException("554 transaction failed"))
                    .when(mailSender)
                    .send(any(SimpleMailMessage.class));

            assertThatThrownBy(() -> transport().send(alert))
                    .isInstanceOfSatisfying(
                            TransportException.class,
                            e -> assertThat(e.getKind()).isEqualTo(TransportFailureKind.PROTOCOL));
        }

        @Test
        @DisplayName("Malformed message is a validation error, not a transport failure")
        void parseFailure() {
            doThrow(new MailParseException("bad address"))
                    .when(mailSender)
                    .send(any(SimpleMailMessage.class));

            assertThatThrownBy(() -> transport().send(alert)).isInstanceOf(AlertValidationException.class);
        }
    }

    @Nested
    @DisplayName("Connection Test")
    class ConnectionTest {

        @Test
        @DisplayName("Succeeds when the handshake succeeds")
        void succeeds() throws Exception {
            assertThatCode(() -> transport().testConnection()).doesNotThrowAnyException();
            verify(mailSender).testConnection();
        }

        @Test
        @DisplayName("Authentication failure during handshake maps to AUTHENTICATION")
        void authenticationFailure() throws Exception {
            doThrow(new AuthenticationFailedException("535")).when(mailSender).testConnection();

            assertThatThrownBy(() -> transport().testConnection())
                    .isInstanceOfSatisfying(
                            TransportException.class,
                            e -> assertThat(e.getKind()).isEqualTo(TransportFailureKind.AUTHENTICATION));
        }
    }
}

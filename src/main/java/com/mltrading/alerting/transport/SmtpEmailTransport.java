package com.mltrading.alerting.transport;

import com.mltrading.config.AlertConfig;
import com.mltrading.domain.enums.TransportFailureKind;
import com.mltrading.domain.model.Alert;
import com.mltrading.exception.AlertValidationException;
import com.mltrading.exception.TransportException;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Date;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSenderImpl;

/**
 * Sends alerts as plain-text e-mail over SMTP.
 *
 * <p>Every send opens its own connection: {@link JavaMailSenderImpl} connects,
 * optionally upgrades with STARTTLS, authenticates, transmits and closes the
 * transport in a finally block, so the connection is released on every path.
 * Connect, read and write are each bounded by {@code email.timeout}.
 *
 * <p>Spring mail exceptions are translated into {@link TransportException} with a
 * {@link TransportFailureKind}, except message preparation/parse errors (a malformed
 * address or payload), which are caller-side problems and surface as
 * {@link AlertValidationException} so the circuit breaker does not count them.
 */
public class SmtpEmailTransport implements EmailTransport {

    private static final Logger log = LoggerFactory.getLogger(SmtpEmailTransport.class);

    private final AlertConfig.EmailSettings settings;
    private final EmailCredentials credentials;
    private final AlertEmailRenderer renderer;
    private final JavaMailSenderImpl mailSender;

    public SmtpEmailTransport(
            AlertConfig.EmailSettings settings, EmailCredentials credentials, AlertEmailRenderer renderer) {
        this(settings, credentials, renderer, createMailSender(settings, credentials));
    }

    public SmtpEmailTransport(
            AlertConfig.EmailSettings settings,
            EmailCredentials credentials,
            AlertEmailRenderer renderer,
            JavaMailSenderImpl mailSender) {
        this.settings = settings;
        this.credentials = credentials;
        this.renderer = renderer;
        this.mailSender = mailSender;

        if (settings.isEnabled() && !isAvailable()) {
            log.warn(
                    "E-mail alerts enabled but not fully configured (sender/password from {}/{}, recipient={}); "
                            + "sends will fail until they are set",
                    EmailCredentials.SENDER_VARIABLE,
                    EmailCredentials.PASSWORD_VARIABLE,
                    settings.getRecipient());
        }
    }

    static JavaMailSenderImpl createMailSender(AlertConfig.EmailSettings settings, EmailCredentials credentials) {
        JavaMailSenderImpl sender = new JavaMailSenderImpl();
        sender.setHost(settings.getSmtpServer());
        sender.setPort(settings.getSmtpPort());
        sender.setUsername(credentials.getSender());
        sender.setPassword(credentials.getPassword());
        sender.setDefaultEncoding("UTF-8");

        String timeoutMillis = String.valueOf(settings.getTimeout().toMillis());
        Properties properties = sender.getJavaMailProperties();
        properties.put("mail.transport.protocol", "smtp");
        properties.put("mail.smtp.auth", "true");
        properties.put("mail.smtp.starttls.enable", String.valueOf(settings.isUseTls()));
        properties.put("mail.smtp.starttls.required", String.valueOf(settings.isUseTls()));
        properties.put("mail.smtp.connectiontimeout", timeoutMillis);
        properties.put("mail.smtp.timeout", timeoutMillis);
        properties.put("mail.smtp.writetimeout", timeoutMillis);
        return sender;
    }

    @Override
    public void send(Alert alert) {
        if (!isAvailable()) {
            throw new TransportException(TransportFailureKind.UNAVAILABLE, "E-mail transport is not configured");
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(credentials.getSender());
        message.setTo(settings.getRecipient());
        message.setSubject(renderer.renderSubject(alert));
        message.setText(renderer.renderBody(alert));
        message.setSentDate(Date.from(alert.getCreatedAt()));

        try {
            mailSender.send(message);
            log.info("Email alert sent: {} - {}", alert.getSeverity(), alert.getTitle());
        } catch (MailParseException | MailPreparationException e) {
            throw new AlertValidationException("Alert could not be rendered as e-mail: " + e.getMessage());
        } catch (MailAuthenticationException e) {
            throw new TransportException(
                    TransportFailureKind.AUTHENTICATION, "SMTP authentication failed: " + e.getMessage(), e);
        } catch (MailException e) {
            TransportFailureKind kind = classify(e);
            throw new TransportException(kind, "SMTP send failed (" + kind + "): " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        return settings.isEnabled()
                && credentials.isComplete()
                && settings.getRecipient() != null
                && !settings.getRecipient().isBlank();
    }

    @Override
    public void testConnection() {
        if (!isAvailable()) {
            throw new TransportException(TransportFailureKind.UNAVAILABLE, "E-mail transport is not configured");
        }
        try {
            mailSender.testConnection();
            log.info("SMTP connection test to {}:{} succeeded", settings.getSmtpServer(), settings.getSmtpPort());
        } catch (MessagingException e) {
            TransportFailureKind kind = classify(e);
            throw new TransportException(kind, "SMTP connection test failed (" + kind + "): " + e.getMessage(), e);
        }
    }

    static TransportFailureKind classify(Throwable failure) {
        for (Throwable cause = failure; cause != null; cause = nextCause(cause)) {
            if (cause instanceof AuthenticationFailedException || cause instanceof MailAuthenticationException) {
                return TransportFailureKind.AUTHENTICATION;
            }
            if (cause instanceof SocketTimeoutException) {
                return TransportFailureKind.TIMEOUT;
            }
            if (cause instanceof ConnectException
                    || cause instanceof UnknownHostException
                    || cause instanceof NoRouteToHostException) {
                return TransportFailureKind.CONNECTION;
            }
        }
        return TransportFailureKind.PROTOCOL;
    }

    // MessagingException keeps its cause in getNextException() on older mail providers
    private static Throwable nextCause(Throwable current) {
        Throwable next = current.getCause();
        if (next == null && current instanceof MessagingException messagingException) {
            next = messagingException.getNextException();
        }
        if (next == null && current instanceof MailSendException sendException) {
            Exception[] nested = sendException.getMessageExceptions();
            next = nested.length > 0 ? nested[0] : null;
        }
        return next == current ? null : next;
    }
}

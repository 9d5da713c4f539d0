package com.mltrading.alerting.transport;

import lombok.Value;
import org.springframework.core.env.Environment;

/**
 * Sender account for the SMTP transport, read from the process environment.
 *
 * <p>Credentials never travel inside the alert configuration snapshot.
 * {@code toString()} masks the password so the value can be logged.
 */
@Value
public class EmailCredentials {

    public static final String SENDER_VARIABLE = "EMAIL_SENDER";
    public static final String PASSWORD_VARIABLE = "EMAIL_PASSWORD";

    String sender;
    String password;

    public static EmailCredentials fromEnvironment(Environment environment) {
        return new EmailCredentials(
                environment.getProperty(SENDER_VARIABLE, ""), environment.getProperty(PASSWORD_VARIABLE, ""));
    }

    public boolean isComplete() {
        return sender != null && !sender.isBlank() && password != null && !password.isBlank();
    }

    @Override
    public String toString() {
        return "EmailCredentials(sender=" + sender + ", password=" + (isComplete() ? "****" : "<missing>") + ")";
    }
}

package dev.reviewgate.infrastructure.notification;

import dev.reviewgate.config.NotificationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Plain-text e-mail via the configured SMTP relay. Disabled in development: messages are only logged.
 */
@Component
public class MailNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(MailNotifier.class);

    private final JavaMailSender mailSender;
    private final NotificationProperties properties;

    public MailNotifier(JavaMailSender mailSender, NotificationProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties;
    }

    @Override
    public boolean send(Collection<String> recipients, String subject, String body) {
        Set<String> to = new LinkedHashSet<>();
        recipients.stream().filter(r -> r != null && !r.isBlank()).forEach(to::add);
        if (to.isEmpty()) {
            log.warn("No recipients for notification '{}', skipping", subject);
            return false;
        }
        if (!properties.enabled()) {
            log.info("Notifications disabled; would send '{}' to {}", subject, to);
            return false;
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(properties.from());
        message.setTo(to.toArray(String[]::new));
        message.setSubject(subject);
        message.setText(body);
        try {
            mailSender.send(message);
            log.info("Notification '{}' sent to {} recipient(s)", subject, to.size());
            return true;
        } catch (MailException e) {
            log.error("Failed to send notification '{}' to {}: {}", subject, to, e.getMessage(), e);
            return false;
        }
    }
}

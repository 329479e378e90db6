package net.eventmail.integration.spring.mail;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import net.eventmail.core.error.NotificationException;
import net.eventmail.core.spi.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Sends alerts as HTML mail through a Spring {@link JavaMailSender}.
 * <p>
 * Recipients are resolved by {@link Recipients}.
 */
public class MailNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(MailNotifier.class);

    private final JavaMailSender sender;
    private final String from;
    private final Recipients recipients;

    public MailNotifier(JavaMailSender sender, String from, Map<String, String> aliases) {
        this.sender = sender;
        this.from = from;
        this.recipients = new Recipients(aliases);
    }

    @Override
    public void send(String toExpression, String subject, String htmlBody) {
        List<String> to = recipients(toExpression);
        if (to.isEmpty()) {
            throw new NotificationException("no recipients in '" + toExpression + "'", null);
        }
        try {
            MimeMessage msg = sender.createMimeMessage();
            var helper = new MimeMessageHelper(msg, false, StandardCharsets.UTF_8.name());
            helper.setFrom(from);
            helper.setTo(to.toArray(String[]::new));
            helper.setSubject(subject);
            helper.setText(htmlBody, true);
            sender.send(msg);
            log.debug("Mail '{}' sent to {}", subject, to);
        } catch (MessagingException | MailException e) {
            throw new NotificationException("mail '" + subject + "' to " + to + " failed: " + e.getMessage(), e);
        }
    }

    public List<String> recipients(String toExpression) {
        return recipients.expand(toExpression);
    }
}

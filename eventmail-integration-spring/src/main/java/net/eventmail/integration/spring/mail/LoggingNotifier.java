package net.eventmail.integration.spring.mail;

import net.eventmail.core.spi.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Used when mail is switched off: the alert only goes to the log. */
public class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void send(String toExpression, String subject, String htmlBody) {
        log.warn("Mail disabled, alert not sent. to='{}' subject='{}'", toExpression, subject);
        log.debug("Alert body: {}", htmlBody);
    }
}

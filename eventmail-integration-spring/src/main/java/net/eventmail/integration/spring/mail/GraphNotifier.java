package net.eventmail.integration.spring.mail;

import com.azure.identity.ClientSecretCredential;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.microsoft.graph.models.BodyType;
import com.microsoft.graph.models.EmailAddress;
import com.microsoft.graph.models.ItemBody;
import com.microsoft.graph.models.Message;
import com.microsoft.graph.models.Recipient;
import com.microsoft.graph.serviceclient.GraphServiceClient;
import com.microsoft.graph.users.item.sendmail.SendMailPostRequestBody;
import net.eventmail.core.error.NotificationException;
import net.eventmail.core.spi.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Sends alerts as HTML mail through Microsoft Graph ({@code users/{sender}/sendMail}) with an
 * app-only client-secret credential. The message is kept in the sender's Sent Items.
 */
public class GraphNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(GraphNotifier.class);

    static final String GRAPH_SCOPE = "https://graph.microsoft.com/.default";

    /** Graph 호출 지점: 보내는 사서함 + 요청 본문 */
    @FunctionalInterface
    public interface Mailbox {
        void sendMail(String senderAddress, SendMailPostRequestBody request);
    }

    private final Mailbox mailbox;
    private final String senderAddress;
    private final Recipients recipients;

    public GraphNotifier(Mailbox mailbox, String senderAddress, Map<String, String> aliases) {
        this.mailbox = mailbox;
        this.senderAddress = senderAddress;
        this.recipients = new Recipients(aliases);
    }

    /** 토큰은 첫 발송 때 받아온다. 여기서는 네트워크를 타지 않음 */
    public static GraphNotifier create(String tenantId, String clientId, String clientSecret,
                                       String senderAddress, Map<String, String> aliases) {
        ClientSecretCredential credential = new ClientSecretCredentialBuilder()
                .tenantId(tenantId)
                .clientId(clientId)
                .clientSecret(clientSecret)
                .build();
        var graph = new GraphServiceClient(credential, GRAPH_SCOPE);
        return new GraphNotifier((sender, request) -> graph.users().byUserId(sender).sendMail().post(request),
                senderAddress, aliases);
    }

    @Override
    public void send(String toExpression, String subject, String htmlBody) {
        List<String> to = recipients.expand(toExpression);
        if (to.isEmpty()) {
            throw new NotificationException("no recipients in '" + toExpression + "'", null);
        }
        try {
            mailbox.sendMail(senderAddress, request(subject, htmlBody, to));
            log.debug("Graph mail '{}' sent from {} to {}", subject, senderAddress, to);
        } catch (RuntimeException e) {
            throw new NotificationException("graph mail '" + subject + "' to " + to + " failed: " + e.getMessage(), e);
        }
    }

    public List<String> recipients(String toExpression) {
        return recipients.expand(toExpression);
    }

    static SendMailPostRequestBody request(String subject, String htmlBody, List<String> to) {
        var body = new ItemBody();
        body.setContentType(BodyType.Html);
        body.setContent(htmlBody);

        var message = new Message();
        message.setSubject(subject);
        message.setBody(body);
        message.setToRecipients(to.stream().map(GraphNotifier::recipient).toList());

        var request = new SendMailPostRequestBody();
        request.setMessage(message);
        request.setSaveToSentItems(true);
        return request;
    }

    private static Recipient recipient(String address) {
        var email = new EmailAddress();
        email.setAddress(address);
        var r = new Recipient();
        r.setEmailAddress(email);
        return r;
    }
}

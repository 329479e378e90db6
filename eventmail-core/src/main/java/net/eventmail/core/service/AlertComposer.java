package net.eventmail.core.service;

import net.eventmail.core.model.ResultRow;
import net.eventmail.core.spi.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Filters procedure rows by their {@code Triggered} column and mails an HTML summary when the
 * job's gate is on and at least one row fired.
 */
public final class AlertComposer {
    private static final Logger log = LoggerFactory.getLogger(AlertComposer.class);

    public static final int MAX_ROWS = 50;

    public enum Outcome { SENT, GATE_OFF, NOT_TRIGGERED }

    /**
     * @throws net.eventmail.core.error.NotificationException when the notifier fails
     */
    public Outcome composeAndSend(String jobName,
                                  List<ResultRow> rows,
                                  boolean fireOnAnyTrue,
                                  String recipients,
                                  Notifier notifier) {
        if (!fireOnAnyTrue) return Outcome.GATE_OFF;

        List<ResultRow> triggered = rows.stream().filter(ResultRow::triggered).limit(MAX_ROWS).toList();
        if (triggered.isEmpty()) return Outcome.NOT_TRIGGERED;

        notifier.send(recipients, subject(jobName), renderHtml(jobName, triggered));
        log.info("Alert emailed for {} ({} triggered rows shown)", jobName, triggered.size());
        return Outcome.SENT;
    }

    public static String subject(String jobName) {
        return "SP Triggered: " + jobName;
    }

    /** 컬럼 순서는 첫 번째 행 기준. 다른 행에 없는 컬럼은 빈 칸 */
    public static String renderHtml(String jobName, List<ResultRow> triggered) {
        if (triggered.isEmpty()) {
            return "<p><b>" + escape(jobName) + "</b> returned no triggered rows.</p>";
        }
        List<String> cols = triggered.get(0).columns();
        var sb = new StringBuilder()
                .append("<h3>Stored Procedure Triggered: ").append(escape(jobName)).append("</h3>")
                .append("<p>One or more records returned <b>Triggered = True</b>.</p>")
                .append("<table border='1' cellpadding='4' cellspacing='0'><thead><tr>");
        for (String c : cols) sb.append("<th>").append(escape(c)).append("</th>");
        sb.append("</tr></thead><tbody>");
        for (ResultRow r : triggered.subList(0, Math.min(MAX_ROWS, triggered.size()))) {
            sb.append("<tr>");
            for (String c : cols) {
                Object v = r.get(c);
                sb.append("<td>").append(escape(v == null ? "" : v.toString())).append("</td>");
            }
            sb.append("</tr>");
        }
        return sb.append("</tbody></table>").toString();
    }

    static String escape(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }
}

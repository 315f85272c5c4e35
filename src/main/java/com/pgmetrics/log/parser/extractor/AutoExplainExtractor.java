package com.pgmetrics.log.parser.extractor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.pgmetrics.log.parser.LogEntry;
import com.pgmetrics.log.parser.accumulator.LogFactsAccumulator;
import com.pgmetrics.log.parser.model.Plan;
import com.pgmetrics.log.parser.model.PlanFormat;

/**
 * Plans logged by auto_explain. The output format is recognised from the
 * line following "duration: N ms  plan:":
 * <ul>
 * <li>json - an opening brace</li>
 * <li>xml - an {@code <explain xmlns=...>} element</li>
 * <li>yaml - a quoted {@code Query Text: "..."}</li>
 * <li>text - an unquoted {@code Query Text: ...}</li>
 * </ul>
 * Only json and text plans are extracted; for xml and yaml the format is
 * recorded with an empty query and plan.
 */
public class AutoExplainExtractor implements EntryExtractor {

    private static final Logger logger = LoggerFactory.getLogger(AutoExplainExtractor.class);

    static final String QUERY_TEXT = "Query Text";

    static final Pattern START = Pattern.compile(
            "^duration: [0-9]+\\.[0-9]+ ms  plan:\\n[ \\t]+"
            + "(\\{[ \\t]*\\n)?"            // json (group 1)
            + "(<explain xml.*\\n)?"         // xml (group 2)
            + "(Query Text: \".*\"\\n)?"     // yaml (group 3)
            + "(Query Text: [^\"].*\\n)?",   // text (group 4)
            Pattern.UNIX_LINES);

    static final Pattern TEXT_QUERY = Pattern.compile("\\s+Query Text: (.*)", Pattern.UNIX_LINES);
    static final Pattern TEXT_PLAN_ROW = Pattern.compile("cost=\\d+.*rows=\\d", Pattern.UNIX_LINES);

    @Override
    public boolean matches(LogEntry entry) {
        return START.matcher(entry.getLine()).lookingAt();
    }

    @Override
    public void extract(LogEntry entry, LogFactsAccumulator accumulator) {
        Matcher m = START.matcher(entry.getLine());
        if (!m.lookingAt()) {
            return;
        }

        PlanFormat format = PlanFormat.TEXT;
        String query = "";
        String plan = "";

        if (m.group(1) != null) {
            format = PlanFormat.JSON;
            String[] json = extractJson(entry.getLine());
            query = json[0];
            plan = json[1];
        } else if (m.group(2) != null) {
            format = PlanFormat.XML;
            logger.warn("xml format auto_explain output not supported yet");
        } else if (m.group(3) != null) {
            format = PlanFormat.YAML;
            logger.warn("yaml format auto_explain output not supported yet");
        } else if (m.group(4) != null) {
            String[] text = extractText(entry.getLine());
            query = text[0];
            plan = text[1];
        }

        accumulator.accumulate(new Plan(entry.getDatabase(), entry.getUser(), format,
                entry.getTimestamp().getEpochSecond(), query, plan));
    }

    /**
     * Everything after the first line is the JSON document. The query text
     * is moved out of it; a document that fails to parse yields an empty
     * query and plan.
     *
     * @return query and plan
     */
    static String[] extractJson(String line) {
        int nl = line.indexOf('\n');
        if (nl < 0) {
            return new String[] { "", "" };
        }
        try {
            JSONObject obj = new JSONObject(line.substring(nl + 1));
            String query = "";
            if (obj.has(QUERY_TEXT)) {
                Object q = obj.remove(QUERY_TEXT);
                if (q instanceof String) {
                    query = (String) q;
                }
            }
            return new String[] { query, obj.toString() };
        } catch (JSONException e) {
            logger.debug("Could not parse json auto_explain output: {}", e.getMessage());
            return new String[] { "", "" };
        }
    }

    /**
     * Lines up to the "Query Text:" line are skipped. The query runs from
     * there until the first plan row (a line with cost= and rows=), and the
     * plan from that row to the end.
     *
     * @return query and plan
     */
    static String[] extractText(String line) {
        StringBuilder query = new StringBuilder();
        StringBuilder plan = new StringBuilder();
        StringBuilder target = null;

        for (String l : line.split("\n", -1)) {
            Matcher q = TEXT_QUERY.matcher(l);
            if (q.matches()) {
                query.setLength(0);
                query.append(q.group(1));
                target = query;
                continue;
            } else if (TEXT_PLAN_ROW.matcher(l).find()) {
                target = plan;
            }
            if (target != null) {
                target.append(l).append('\n');
            }
        }
        return new String[] { query.toString(), plan.toString() };
    }
}

package clusterwatch.collector;

import java.util.ArrayList;
import java.util.List;

/**
 * Slurm hostlist and CPU id range expressions.
 */
public final class HostList {

    private HostList() {
    }

    /**
     * Expand a hostlist such as {@code node[01-03,07],gpu5} into individual host names.
     * Zero padding of range bounds is preserved.
     *
     * @throws IllegalArgumentException on unbalanced brackets or a malformed range
     */
    public static List<String> expand(String expression) {
        List<String> hosts = new ArrayList<>();
        if (expression == null || expression.isBlank()) {
            return hosts;
        }
        for (String term : splitTopLevel(expression.trim())) {
            expandTerm(term, hosts);
        }
        return hosts;
    }

    /**
     * Number of CPUs named by an id list such as {@code 0-3,8,10-11}.
     */
    public static int countIds(String ids) {
        if (ids == null || ids.isBlank()) {
            return 0;
        }
        int count = 0;
        for (String piece : ids.split(",")) {
            String range = piece.trim();
            if (range.isEmpty()) {
                continue;
            }
            int dash = range.indexOf('-');
            if (dash < 0) {
                Integer.parseInt(range);
                count++;
            } else {
                int from = Integer.parseInt(range.substring(0, dash));
                int to = Integer.parseInt(range.substring(dash + 1));
                if (to < from) {
                    throw new IllegalArgumentException("Descending id range: " + range);
                }
                count += to - from + 1;
            }
        }
        return count;
    }

    private static void expandTerm(String term, List<String> hosts) {
        int open = term.indexOf('[');
        if (open < 0) {
            hosts.add(term);
            return;
        }
        int close = term.indexOf(']', open);
        if (close < 0) {
            throw new IllegalArgumentException("Unbalanced brackets in hostlist: " + term);
        }
        String prefix = term.substring(0, open);
        String suffix = term.substring(close + 1);
        for (String range : term.substring(open + 1, close).split(",")) {
            int dash = range.indexOf('-');
            if (dash < 0) {
                // the suffix may itself hold another bracket group
                expandTerm(prefix + range + suffix, hosts);
                continue;
            }
            String lo = range.substring(0, dash);
            String hi = range.substring(dash + 1);
            int from;
            int to;
            try {
                from = Integer.parseInt(lo);
                to = Integer.parseInt(hi);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed hostlist range: " + range, e);
            }
            if (to < from) {
                throw new IllegalArgumentException("Descending hostlist range: " + range);
            }
            int width = lo.length();
            for (int i = from; i <= to; i++) {
                String number = String.valueOf(i);
                while (number.length() < width) {
                    number = "0" + number;
                }
                expandTerm(prefix + number + suffix, hosts);
            }
        }
    }

    private static List<String> splitTopLevel(String expression) {
        List<String> terms = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addTerm(terms, expression.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Unbalanced brackets in hostlist: " + expression);
        }
        addTerm(terms, expression.substring(start));
        return terms;
    }

    private static void addTerm(List<String> terms, String term) {
        String trimmed = term.trim();
        if (!trimmed.isEmpty()) {
            terms.add(trimmed);
        }
    }
}

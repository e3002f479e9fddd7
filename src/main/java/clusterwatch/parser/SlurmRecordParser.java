package clusterwatch.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decoder for the output of {@code scontrol show ...}.
 *
 * Input is one or more blocks separated by blank lines. Inside a block every
 * {@code Key=} token starts a field whose value runs up to the next key token
 * or the end of the block, e.g.
 *
 * <pre>
 * NodeName=node01 Arch=x86_64 CoresPerSocket=32
 *    OS=Linux 4.18.0 #1 SMP
 *    CfgTRES=cpu=64,mem=1031314M,gres/gpu=4
 * </pre>
 *
 * No generic document tree is built: blocks expose a {@link RecordReader} and the
 * caller's {@link RecordMapper} pulls fields through typed {@link ValueDecoder}s.
 */
public final class SlurmRecordParser {

    private static final Pattern BLOCK_SEPARATOR = Pattern.compile("\\r?\\n\\s*\\n");
    private static final Pattern KEY = Pattern.compile("(?:^|\\s)([A-Za-z0-9_/:.\\-]+)=");
    private static final Set<String> ABSENT = Set.of("", "(null)", "None");

    private SlurmRecordParser() {
    }

    /**
     * Split raw text into trimmed, non-empty blocks in document order.
     */
    public static List<String> splitBlocks(String text) {
        List<String> blocks = new ArrayList<>();
        if (text == null) {
            return blocks;
        }
        for (String block : BLOCK_SEPARATOR.split(text)) {
            String trimmed = block.trim();
            if (!trimmed.isEmpty()) {
                blocks.add(trimmed);
            }
        }
        return blocks;
    }

    /**
     * Parse one block into its fields.
     *
     * @throws RecordParseException if the block contains no {@code Key=} token
     */
    public static RecordBlock parseBlock(String block) throws RecordParseException {
        Matcher matcher = KEY.matcher(block);
        List<int[]> spans = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        while (matcher.find()) {
            spans.add(new int[] { matcher.start(), matcher.end() });
            keys.add(matcher.group(1));
        }
        if (keys.isEmpty()) {
            throw new RecordParseException("No Key=Value field in block: " + abbreviate(block));
        }

        RecordBlock record = RecordBlock.builder();
        for (int i = 0; i < keys.size(); i++) {
            int valueStart = spans.get(i)[1];
            int valueEnd = i + 1 < spans.size() ? spans.get(i + 1)[0] : block.length();
            String value = trimValue(block.substring(valueStart, valueEnd));
            if (ABSENT.contains(value)) {
                continue;
            }
            record.add(keys.get(i), value);
        }
        return record;
    }

    /**
     * Parse every block of the input.
     */
    public static List<RecordBlock> parseBlocks(String text) throws RecordParseException {
        List<RecordBlock> records = new ArrayList<>();
        for (String block : splitBlocks(text)) {
            records.add(parseBlock(block));
        }
        return records;
    }

    /**
     * Parse the input as a sequence of records. A single block yields a one-element list.
     * The first failing block aborts the whole batch.
     */
    public static <T> List<T> parseRecords(String text, RecordMapper<T> mapper) throws RecordParseException {
        List<T> result = new ArrayList<>();
        for (RecordBlock block : parseBlocks(text)) {
            result.add(mapper.map(block));
        }
        return result;
    }

    /**
     * Parse the input as exactly one record.
     *
     * @throws RecordParseException if the input has no block or more than one
     */
    public static <T> T parseRecord(String text, RecordMapper<T> mapper) throws RecordParseException {
        List<String> blocks = splitBlocks(text);
        if (blocks.isEmpty()) {
            throw new RecordParseException("No record found");
        }
        if (blocks.size() > 1) {
            throw new RecordParseException("Expected one record but found " + blocks.size());
        }
        return mapper.map(parseBlock(blocks.get(0)));
    }

    private static String trimValue(String raw) {
        int start = 0;
        int end = raw.length();
        while (start < end && isTrimmable(raw.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(raw.charAt(end - 1))) {
            end--;
        }
        return raw.substring(start, end);
    }

    private static boolean isTrimmable(char c) {
        return c == ',' || Character.isWhitespace(c);
    }

    private static String abbreviate(String block) {
        return block.length() <= 60 ? block : block.substring(0, 60) + "...";
    }
}

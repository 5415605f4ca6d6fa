package com.assessorai.infrastructure.ai.chunking;

import com.assessorai.domain.pipeline.model.ChunkPlan;
import com.assessorai.domain.pipeline.model.ChunkSegment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text that exceeds a token ceiling into paragraph-aligned segments.
 *
 * Text is cut into units at blank lines; a unit larger than the free space of a
 * segment is cut again at the sentence boundary nearest to a character target.
 * Units are packed greedily and every segment after the first starts with the
 * trailing units of its predecessor that fit in the overlap budget.
 * The plan is a pure function of (text, ceiling, overlap, maxSegments).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextChunker {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t]*\\n");
    private static final String[] SENTENCE_MARKERS = {". ", ".\n", "! ", "? ", "?\n", "\n"};
    private static final int BOUNDARY_WINDOW = 200;
    private static final int MIN_TARGET_CHARS = 200;
    private static final double TARGET_SAFETY = 0.9;

    private final TokenCounter tokenCounter;

    private record Unit(int start, int end, int tokens) {}

    private record Range(int from, int next, int to) {}

    /**
     * @param text          source text
     * @param ceiling       maximum tokens per segment
     * @param overlapTokens tokens carried over from the previous segment, below the ceiling
     * @param maxSegments   keep at most this many segments (first and last always kept); 0 for no limit
     */
    public ChunkPlan plan(String text, int ceiling, int overlapTokens, int maxSegments) {
        if (ceiling <= 0) {
            throw new IllegalArgumentException("Token ceiling must be positive: " + ceiling);
        }
        if (overlapTokens < 0 || overlapTokens >= ceiling) {
            throw new IllegalArgumentException(
                    "Overlap must be in [0, ceiling): overlap=" + overlapTokens + ", ceiling=" + ceiling);
        }
        String source = text == null ? "" : text;
        int totalTokens = tokenCounter.count(source);
        if (totalTokens <= ceiling) {
            return ChunkPlan.single(source.length(), totalTokens, ceiling);
        }

        List<Unit> units = splitUnits(source, ceiling - overlapTokens);
        int[] prefix = new int[units.size() + 1];
        for (int i = 0; i < units.size(); i++) {
            prefix[i + 1] = prefix[i] + units.get(i).tokens();
        }

        List<Range> ranges = pack(units, ceiling, overlapTokens);
        List<Range> kept = limit(ranges, maxSegments);

        List<ChunkSegment> segments = new ArrayList<>();
        BitSet covered = new BitSet(units.size());
        for (Range r : kept) {
            covered.set(r.from(), r.to());
            segments.add(new ChunkSegment(
                    ranges.indexOf(r),
                    units.get(r.from()).start(),
                    units.get(r.to() - 1).end(),
                    prefix[r.from()],
                    prefix[r.to()],
                    prefix[r.to()] - prefix[r.from()],
                    prefix[r.next()] - prefix[r.from()]));
        }

        int unitTokens = prefix[units.size()];
        int coveredTokens = covered.stream().map(i -> units.get(i).tokens()).sum();
        double coverage = unitTokens == 0 ? 1.0 : (double) coveredTokens / unitTokens;

        if (kept.size() < ranges.size()) {
            log.info("[Chunker] dropped {} of {} segments (maxSegments={}), coverage={}",
                    ranges.size() - kept.size(), ranges.size(), maxSegments, String.format("%.3f", coverage));
        }
        return new ChunkPlan(segments, unitTokens, ceiling, coverage, true);
    }

    private List<Range> pack(List<Unit> units, int ceiling, int overlapTokens) {
        List<Range> ranges = new ArrayList<>();
        int next = 0;
        while (next < units.size()) {
            int from = next;
            int tokens = 0;
            if (!ranges.isEmpty()) {
                Range previous = ranges.get(ranges.size() - 1);
                while (from - 1 > previous.from() && tokens + units.get(from - 1).tokens() <= overlapTokens) {
                    from--;
                    tokens += units.get(from).tokens();
                }
                while (from < next && tokens + units.get(next).tokens() > ceiling) {
                    tokens -= units.get(from).tokens();
                    from++;
                }
            }
            int to = next;
            while (to < units.size() && (to == next || tokens + units.get(to).tokens() <= ceiling)) {
                tokens += units.get(to).tokens();
                to++;
            }
            ranges.add(new Range(from, next, to));
            next = to;
        }
        return ranges;
    }

    private List<Range> limit(List<Range> ranges, int maxSegments) {
        if (maxSegments <= 0 || ranges.size() <= maxSegments) {
            return ranges;
        }
        int keep = Math.max(2, maxSegments);
        List<Range> kept = new ArrayList<>(ranges.subList(0, keep - 1));
        kept.add(ranges.get(ranges.size() - 1));
        return kept;
    }

    private List<Unit> splitUnits(String text, int maxUnitTokens) {
        List<Unit> units = new ArrayList<>();
        Matcher matcher = PARAGRAPH_BREAK.matcher(text);
        int start = 0;
        while (matcher.find()) {
            addUnit(units, text, start, matcher.end(), maxUnitTokens);
            start = matcher.end();
        }
        if (start < text.length()) {
            addUnit(units, text, start, text.length(), maxUnitTokens);
        }
        return units;
    }

    private void addUnit(List<Unit> units, String text, int start, int end, int maxTokens) {
        int tokens = tokenCounter.count(text.substring(start, end));
        if (tokens <= maxTokens) {
            units.add(new Unit(start, end, tokens));
            return;
        }
        double charsPerToken = (double) (end - start) / tokens;
        int target = Math.max(MIN_TARGET_CHARS, (int) (maxTokens * charsPerToken * TARGET_SAFETY));
        int pos = start;
        while (pos < end) {
            int span = target;
            int cut;
            int pieceTokens;
            while (true) {
                cut = pos + span >= end ? end : boundaryBefore(text, pos, pos + span);
                pieceTokens = tokenCounter.count(text.substring(pos, cut));
                if (pieceTokens <= maxTokens || cut - pos <= 1) {
                    break;
                }
                span = Math.max(1, (cut - pos) / 2);
            }
            units.add(new Unit(pos, cut, pieceTokens));
            pos = cut;
        }
    }

    /**
     * Latest sentence boundary in the window ending at {@code limit}, or {@code limit} itself.
     */
    private int boundaryBefore(String text, int from, int limit) {
        int floor = Math.max(from + 1, limit - BOUNDARY_WINDOW);
        int best = -1;
        for (String marker : SENTENCE_MARKERS) {
            int idx = text.lastIndexOf(marker, limit - marker.length());
            int boundary = idx + marker.length();
            if (idx >= from && boundary >= floor && boundary > best) {
                best = boundary;
            }
        }
        int cut = best > 0 ? best : limit;
        if (cut < text.length() && Character.isLowSurrogate(text.charAt(cut)) && cut - 1 > from) {
            cut--;
        }
        return cut;
    }
}

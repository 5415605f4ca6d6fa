package com.assessorai.domain.pipeline.model;

/**
 * Token-bounded slice of a source text.
 *
 * @param index               position in the original segmentation (gaps mean dropped segments)
 * @param startOffset         inclusive character offset
 * @param endOffset           exclusive character offset
 * @param startToken          inclusive token position
 * @param endToken            exclusive token position
 * @param tokenCount          estimated tokens in the slice
 * @param overlapWithPrevious tokens shared with the preceding segment
 */
public record ChunkSegment(
        int index,
        int startOffset,
        int endOffset,
        int startToken,
        int endToken,
        int tokenCount,
        int overlapWithPrevious
) {
    public String slice(String source) {
        return source.substring(startOffset, endOffset);
    }
}

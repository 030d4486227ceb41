package com.scholary.lecture.corrector.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits a raw transcript into timestamped blocks.
 *
 * <p>The input format is zero or more headers of the form {@code [H:MM:SS - H:MM:SS]}, each
 * followed by free text up to the next header or the end of input. Rules:
 *
 * <ul>
 *   <li>Text before the first header is ignored
 *   <li>Blocks whose text is blank are dropped
 *   <li>Block text is trimmed
 *   <li>A header that looks like a timestamp pair but does not parse keeps its block, with both
 *       timestamps set to {@link #SENTINEL_TIME}
 * </ul>
 */
@Component
public class TranscriptSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptSegmenter.class);

  public static final String SENTINEL_TIME = "00:00:00";

  // Two colon-separated number groups, whether or not they are well formed timestamps.
  // A plain range such as [0 - 9] is lecture text, not a header.
  private static final Pattern HEADER_LIKE =
      Pattern.compile("\\[\\s*\\d+(?::\\d+)+\\s*-\\s*\\d+(?::\\d+)+\\s*\\]");

  private static final Pattern HEADER =
      Pattern.compile("\\[\\s*(\\d+:\\d+:\\d+)\\s*-\\s*(\\d+:\\d+:\\d+)\\s*\\]");

  /**
   * Split raw transcript text into ordered blocks.
   *
   * @param rawText the transcript text, may be null or empty
   * @return blocks in source order, never null
   */
  public List<TranscriptBlock> split(String rawText) {
    if (rawText == null || rawText.isBlank()) {
      return List.of();
    }

    List<TranscriptBlock> blocks = new ArrayList<>();
    Matcher matcher = HEADER_LIKE.matcher(rawText);

    String header = null;
    int contentStart = -1;

    while (matcher.find()) {
      if (header != null) {
        addBlock(blocks, header, rawText.substring(contentStart, matcher.start()));
      }
      header = matcher.group();
      contentStart = matcher.end();
    }

    if (header != null) {
      addBlock(blocks, header, rawText.substring(contentStart));
    }

    LOGGER.debug("Split transcript into {} blocks", blocks.size());
    return blocks;
  }

  private void addBlock(List<TranscriptBlock> blocks, String header, String content) {
    String text = content.strip();
    if (text.isEmpty()) {
      return;
    }

    Matcher timestamps = HEADER.matcher(header);
    if (timestamps.matches()) {
      blocks.add(new TranscriptBlock(timestamps.group(1), timestamps.group(2), text));
    } else {
      LOGGER.warn("Unparseable timestamp header {}, using {}", header, SENTINEL_TIME);
      blocks.add(new TranscriptBlock(SENTINEL_TIME, SENTINEL_TIME, text));
    }
  }
}

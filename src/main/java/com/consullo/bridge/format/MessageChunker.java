package com.consullo.bridge.format;

import com.consullo.bridge.text.LineType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.commons.lang3.Validate;

/**
 * Splits normalized text into transport-bounded, decorated chunks.
 *
 * <p>
 * Splitting uses the first strategy that produces units small enough, in priority order:
 * <ol>
 * <li>line boundaries</li>
 * <li>sentence boundaries (a run of {@code . ! ?} followed by whitespace)</li>
 * <li>word boundaries</li>
 * <li>hard character split, only for a single unit that still exceeds the budget</li>
 * </ol>
 * Each strategy is applied to oversized units of the previous one, so a long line inside otherwise short text only
 * gets split further itself. Separators that fall exactly on a chunk boundary are not repeated; no other character
 * is dropped.
 * </p>
 *
 * <p>
 * The configured limit holds after decoration: the split budget reserves room for the code fence and the
 * {@code **Part i/N**} prefix. Text that fits the limit undecorated but not decorated is sent as one plain chunk
 * rather than split.
 * </p>
 *
 * <p>Chunks are returned in textual order; {@link MessageChunk#priority()} is advisory for consumers only.
 *
 * @since 1.0
 */
public final class MessageChunker {

  /** Hard message limit of common chat transports. */
  public static final int TRANSPORT_MAX_LENGTH = 2000;

  /** Working limit leaving headroom below the transport limit. */
  public static final int DEFAULT_MAX_LENGTH = 1900;

  /** Smallest accepted limit. */
  public static final int MIN_MAX_LENGTH = 64;

  private static final String FENCE = "```";
  private static final int INLINE_MAX_LENGTH = 50;
  private static final int SHORT_TEXT_LENGTH = 100;
  // "**Part 9999/9999**\n"
  private static final int PART_PREFIX_RESERVE = 20;
  private static final String[] URGENT_KEYWORDS = {"error", "failed", "success", "complete"};

  private enum SplitLevel {
    LINE, SENTENCE, WORD, CHARACTER;

    SplitLevel next() {
      return values()[Math.min(ordinal() + 1, CHARACTER.ordinal())];
    }
  }

  private final int maxLength;

  /**
   * Creates a chunker with {@link #DEFAULT_MAX_LENGTH}.
   */
  public MessageChunker() {
    this(DEFAULT_MAX_LENGTH);
  }

  /**
   * Creates a chunker.
   *
   * @param maxLength maximum content length of every produced chunk
   */
  public MessageChunker(final int maxLength) {
    Validate.isTrue(maxLength >= MIN_MAX_LENGTH, "maxLength must be at least %d", MIN_MAX_LENGTH);
    this.maxLength = maxLength;
  }

  public int maxLength() {
    return maxLength;
  }

  /**
   * Formats text into an ordered chunk list.
   *
   * @param text normalized text (may be null)
   * @param type aggregate line type of the text
   * @return chunks in textual order; empty for null or blank text
   */
  public List<MessageChunk> format(final String text, final LineType type) {
    Validate.notNull(type, "type must not be null");
    if (text == null || text.isBlank()) {
      return List.of();
    }

    final Instant now = Instant.now();
    final int priority = priority(text, type);
    ChunkFormat format = chooseFormat(text, type);
    String body = format == ChunkFormat.CODE_BLOCK || format == ChunkFormat.INLINE_CODE ? text.strip() : text;
    String language = format == ChunkFormat.CODE_BLOCK ? LanguageDetector.detect(body) : "";

    final String single = decorate(body, format, language);
    if (single.length() <= maxLength) {
      return List.of(chunk(single, type, priority, now, 0, 1, language, format, body, text.length()));
    }
    if (body.length() <= maxLength) {
      // Decoration is dropped before content gets split.
      return List.of(chunk(body, type, priority, now, 0, 1, "", ChunkFormat.PLAIN, body, text.length()));
    }

    final int budget = maxLength - overhead(format, language) - PART_PREFIX_RESERVE;
    final List<String> pieces = new ArrayList<>();
    split(body, budget, SplitLevel.LINE, pieces);

    final int total = pieces.size();
    final List<MessageChunk> out = new ArrayList<>(total);
    for (int i = 0; i < total; i++) {
      final String piece = pieces.get(i);
      String content = decorate(piece, format, language);
      if (total > 1) {
        final String prefix = "**Part " + (i + 1) + "/" + total + "**\n";
        if (prefix.length() + content.length() <= maxLength) {
          content = prefix + content;
        }
      }
      if (content.length() > maxLength) {
        throw new IllegalStateException(
            "Chunk of " + content.length() + " chars exceeds limit " + maxLength);
      }
      out.add(chunk(content, type, priority, now, i, total, language, format, piece, text.length()));
    }
    return out;
  }

  /**
   * Computes the advisory delivery priority of a text.
   *
   * @param text text
   * @param type line type
   * @return type base priority, plus 10 for short text, plus 20 for urgency keywords
   */
  public static int priority(final String text, final LineType type) {
    int priority = type.basePriority();
    if (text.length() < SHORT_TEXT_LENGTH) {
      priority += 10;
    }
    final String lower = text.toLowerCase(Locale.ROOT);
    for (String keyword : URGENT_KEYWORDS) {
      if (lower.contains(keyword)) {
        priority += 20;
        break;
      }
    }
    return priority;
  }

  static ChunkFormat chooseFormat(final String text, final LineType type) {
    if (type == LineType.ERROR || type == LineType.WARNING) {
      return ChunkFormat.EMBED;
    }
    if (text.contains(FENCE)) {
      return ChunkFormat.PLAIN;
    }
    if (type == LineType.CODE || LanguageDetector.looksLikeCode(text)) {
      return ChunkFormat.CODE_BLOCK;
    }
    final String t = text.strip();
    if (t.length() < INLINE_MAX_LENGTH && t.indexOf('\n') < 0 && t.indexOf('`') < 0) {
      return ChunkFormat.INLINE_CODE;
    }
    return ChunkFormat.PLAIN;
  }

  private static String decorate(final String body, final ChunkFormat format, final String language) {
    switch (format) {
      case CODE_BLOCK:
        return FENCE + language + "\n" + body + "\n" + FENCE;
      case INLINE_CODE:
        return "`" + body + "`";
      default:
        return body;
    }
  }

  private static int overhead(final ChunkFormat format, final String language) {
    switch (format) {
      case CODE_BLOCK:
        return FENCE.length() * 2 + language.length() + 2;
      case INLINE_CODE:
        return 2;
      default:
        return 0;
    }
  }

  private static MessageChunk chunk(
      final String content,
      final LineType type,
      final int priority,
      final Instant timestamp,
      final int index,
      final int total,
      final String language,
      final ChunkFormat format,
      final String text,
      final int originalLength) {
    return new MessageChunk(content, type, priority, timestamp,
        new MessageChunk.Metadata(index, total, language, format, text, originalLength));
  }

  /**
   * Splits {@code text} into pieces of at most {@code budget} chars, appending them to {@code out}.
   */
  private static void split(final String text, final int budget, final SplitLevel level, final List<String> out) {
    if (text.length() <= budget) {
      emit(text, out);
      return;
    }
    if (level == SplitLevel.CHARACTER) {
      hardSplit(text, budget, out);
      return;
    }

    final List<String> units = new ArrayList<>();
    final List<String> separators = new ArrayList<>();
    tokenize(text, level, units, separators);
    if (units.size() <= 1) {
      split(text, budget, level.next(), out);
      return;
    }

    StringBuilder current = null;
    for (int i = 0; i < units.size(); i++) {
      final String unit = units.get(i);
      if (current != null) {
        final String sep = separators.get(i - 1);
        if (current.length() + sep.length() + unit.length() <= budget) {
          current.append(sep).append(unit);
          continue;
        }
        emit(current.toString(), out);
        current = null;
      }
      if (unit.length() <= budget) {
        current = new StringBuilder(unit);
      } else {
        split(unit, budget, level.next(), out);
      }
    }
    if (current != null) {
      emit(current.toString(), out);
    }
  }

  private static void emit(final String piece, final List<String> out) {
    if (!piece.isBlank()) {
      out.add(piece);
    }
  }

  /**
   * Breaks text into units and the separators between them; {@code separators.get(i)} sits between unit i and i+1.
   */
  private static void tokenize(
      final String text, final SplitLevel level, final List<String> units, final List<String> separators) {
    final int n = text.length();
    int unitStart = 0;
    int i = 0;
    while (i < n) {
      final int sepEnd = separatorEnd(text, i, level);
      if (sepEnd > i) {
        final int unitEnd = level == SplitLevel.SENTENCE ? punctuationEnd(text, i) : i;
        units.add(text.substring(unitStart, unitEnd));
        separators.add(text.substring(unitEnd, sepEnd));
        unitStart = sepEnd;
        i = sepEnd;
      } else {
        i++;
      }
    }
    units.add(text.substring(unitStart));
  }

  /**
   * Returns the end of a separator starting at {@code i}, or {@code i} when none starts there.
   */
  private static int separatorEnd(final String text, final int i, final SplitLevel level) {
    final int n = text.length();
    switch (level) {
      case LINE:
        return text.charAt(i) == '\n' ? i + 1 : i;
      case WORD: {
        int j = i;
        while (j < n && text.charAt(j) == ' ') {
          j++;
        }
        return j;
      }
      case SENTENCE: {
        if (!isSentenceEnd(text.charAt(i))) {
          return i;
        }
        int j = i;
        while (j < n && isSentenceEnd(text.charAt(j))) {
          j++;
        }
        if (j >= n || !Character.isWhitespace(text.charAt(j))) {
          return i;
        }
        while (j < n && Character.isWhitespace(text.charAt(j))) {
          j++;
        }
        return j;
      }
      default:
        return i;
    }
  }

  private static int punctuationEnd(final String text, final int i) {
    int j = i;
    while (j < text.length() && isSentenceEnd(text.charAt(j))) {
      j++;
    }
    return j;
  }

  private static boolean isSentenceEnd(final char c) {
    return c == '.' || c == '!' || c == '?';
  }

  private static void hardSplit(final String text, final int budget, final List<String> out) {
    final int n = text.length();
    int start = 0;
    while (start < n) {
      int end = Math.min(start + budget, n);
      if (end < n && end - start > 1 && Character.isHighSurrogate(text.charAt(end - 1))) {
        end--;
      }
      emit(text.substring(start, end), out);
      start = end;
    }
  }
}

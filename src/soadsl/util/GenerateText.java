package soadsl.util;

import java.util.EnumMap;

/**
 * Keyword dictionary of a netlist dialect. Subclasses fill {@link #dictionary} in their constructor.
 */
public abstract class GenerateText {

  public enum DictWords {
    simulator_lang,
    comment,
    section,
    endsection,
    include,
    parameters,
    model,
    continuation,
    assign_eq,
    quote
  }

  public EnumMap<DictWords, String> dictionary = new EnumMap<>(DictWords.class);

  public String GetDict(DictWords input) { return dictionary.getOrDefault(input, ""); }

  /** A line comment. */
  public String Comment(String text) { return GetDict(DictWords.comment) + " " + text; }

  /** {@code name=value} as written on a continuation line. */
  public String Assign(String name, String value) { return name + GetDict(DictWords.assign_eq) + value; }

  /** {@code text} enclosed in the dialect's string quotes, embedded quotes escaped. */
  public String Quote(String text) {
    String quote = GetDict(DictWords.quote);
    return quote + text.replace(quote, "\\" + quote) + quote;
  }

  /** A continuation line carrying {@code content}. */
  public String Continue(String content) { return GetDict(DictWords.continuation) + " " + content; }
}

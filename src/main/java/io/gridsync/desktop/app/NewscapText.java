package io.gridsync.desktop.app;

import java.util.Objects;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;

/** Text helpers for newscap message bodies. */
final class NewscapText {

  private static final Document.OutputSettings RAW_OUTPUT =
      new Document.OutputSettings().prettyPrint(false);

  private NewscapText() {}

  /** Paragraph tags become blank lines; every other tag is dropped and entities are decoded. */
  static String toPlainText(String html) {
    String s = Objects.toString(html, "");
    if (s.isEmpty()) return "";
    String withBreaks = s.replace("<p>", "\n\n");
    String stripped = Jsoup.clean(withBreaks, "", Safelist.none(), RAW_OUTPUT);
    return Parser.unescapeEntities(stripped, false);
  }
}

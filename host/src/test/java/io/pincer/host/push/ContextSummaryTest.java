package io.pincer.host.push;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.pincer.api.context.PageContext;
import io.pincer.host.registry.RecordingSocket;
import io.pincer.host.registry.TabConnection;

public class ContextSummaryTest {
   private static PageContext context(String url, String title, String selected) {
      return new PageContext(url, title, null, selected, null, null, 0);
   }

   @Test
   public void testTitle() {
      assertThat(ContextSummary.format(context("https://example.com", "Example", null)))
            .isEqualTo("Browser tab: Example");
   }

   @Test
   public void testUrlWhenTitleMissing() {
      assertThat(ContextSummary.format(context("https://example.com", "", "")))
            .isEqualTo("Browser tab: https://example.com");
   }

   @Test
   public void testSelectionTruncated() {
      String selected = "x".repeat(150);
      String summary = ContextSummary.format(context("https://example.com", "Example", selected));
      assertThat(summary).isEqualTo("Browser tab: Example\nSelected: \"" + "x".repeat(100) + "...\"");
   }

   @Test
   public void testPushListenerSkipsRepeats() {
      List<String> published = new ArrayList<>();
      ContextPushListener listener = new ContextPushListener((connectionId, text) -> published.add(connectionId + "|" + text));
      TabConnection c1 = new TabConnection("c1", 1, "https://example.com", "Example", new RecordingSocket(), 0);
      TabConnection c2 = new TabConnection("c2", 2, "https://example.com", "Example", new RecordingSocket(), 0);

      listener.onContextUpdate(c1, context("https://example.com", "Example", null));
      listener.onContextUpdate(c1, context("https://example.com", "Example", null));
      listener.onContextUpdate(c2, context("https://example.com", "Example", null));
      listener.onContextUpdate(c2, context("https://example.com", "Example", "picked"));

      assertThat(published).containsExactly(
            "c1|Browser tab: Example",
            "c2|Browser tab: Example",
            "c2|Browser tab: Example\nSelected: \"picked\"");
   }
}

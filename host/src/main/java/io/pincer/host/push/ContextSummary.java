package io.pincer.host.push;

import io.pincer.api.context.PageContext;

public final class ContextSummary {
   static final int MAX_SELECTION = 100;

   private ContextSummary() {
   }

   public static String format(PageContext context) {
      StringBuilder sb = new StringBuilder("Browser tab: ");
      sb.append(context.title().isEmpty() ? context.url() : context.title());
      String selected = context.selectedText();
      if (selected != null && !selected.isEmpty()) {
         sb.append("\nSelected: \"");
         if (selected.length() > MAX_SELECTION) {
            sb.append(selected, 0, MAX_SELECTION).append("...");
         } else {
            sb.append(selected);
         }
         sb.append('"');
      }
      return sb.toString();
   }
}

package com.example.reports.export;

/** Font weight and size for a free text line; a size of zero means the style's text size. */
public record TextOptions(boolean bold, float fontSize) {

  public static TextOptions plain() {
    return new TextOptions(false, 0f);
  }

  public static TextOptions bold(float fontSize) {
    return new TextOptions(true, fontSize);
  }
}

package io.gridsync.desktop.config;

import java.util.NoSuchElementException;

/** Thrown by {@link PreferenceStore#get} when a section/option pair has never been set. */
public class PreferenceNotFoundException extends NoSuchElementException {

  private final String section;
  private final String option;

  public PreferenceNotFoundException(String section, String option) {
    super("No preference set for [" + section + "] " + option);
    this.section = section;
    this.option = option;
  }

  public String section() {
    return section;
  }

  public String option() {
    return option;
  }
}

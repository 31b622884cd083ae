package dev.campfire.discovery;

/** What kind of page the analyser believes a discovered URL points at. */
public enum PageType {
  CAMP_PROVIDER_MAIN,
  CAMP_PROGRAM_LIST,
  AGGREGATOR,
  DIRECTORY,
  UNKNOWN
}

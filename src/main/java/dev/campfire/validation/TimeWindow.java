package dev.campfire.validation;

/** Daily drop-off and pick-up times on a 24-hour clock. */
public record TimeWindow(int dropOffHour, int dropOffMinute, int pickUpHour, int pickUpMinute) {

  public boolean hasValidHours() {
    return isHour(dropOffHour) && isHour(pickUpHour);
  }

  private static boolean isHour(int hour) {
    return hour >= 0 && hour <= 23;
  }
}

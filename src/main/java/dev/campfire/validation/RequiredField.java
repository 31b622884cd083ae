package dev.campfire.validation;

/** Fields a session needs before it can be published, in scoring order. */
public enum RequiredField {
  NAME("name"),
  START_DATE("startDate"),
  TIME_WINDOW("timeWindow"),
  PRICE("price"),
  AGE_OR_GRADE("ageOrGrade"),
  REGISTRATION_URL("registrationUrl");

  private final String key;

  RequiredField(String key) {
    this.key = key;
  }

  /** The name reported in {@link Validation#missingFields()}. */
  public String key() {
    return key;
  }
}

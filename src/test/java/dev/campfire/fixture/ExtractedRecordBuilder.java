package dev.campfire.fixture;

import dev.campfire.validation.ExtractedRecord;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Test builder for {@link ExtractedRecord}. {@link #complete()} starts from a record with all six
 * required fields filled in structured form; {@link #empty()} from a record with nothing.
 */
public final class ExtractedRecordBuilder {

  private @Nullable String name;
  private @Nullable String startDate;
  private @Nullable String endDate;
  private @Nullable String dateRaw;
  private @Nullable Integer dropOffHour;
  private @Nullable Integer dropOffMinute;
  private @Nullable Integer pickUpHour;
  private @Nullable Integer pickUpMinute;
  private @Nullable String timeRaw;
  private @Nullable Integer priceInCents;
  private @Nullable String priceRaw;
  private @Nullable Integer minAge;
  private @Nullable Integer maxAge;
  private @Nullable Integer minGrade;
  private @Nullable Integer maxGrade;
  private @Nullable String ageGradeRaw;
  private @Nullable String location;
  private @Nullable String registrationUrl;
  private List<String> imageUrls = List.of();
  private @Nullable String campName;
  private ExtractedRecord.@Nullable Venue venue;

  public static ExtractedRecordBuilder empty() {
    return new ExtractedRecordBuilder();
  }

  public static ExtractedRecordBuilder complete() {
    return new ExtractedRecordBuilder()
        .name("Lego Robotics Week")
        .startDate("2025-06-16")
        .endDate("2025-06-20")
        .dropOffHour(9)
        .pickUpHour(15)
        .priceInCents(35000)
        .minAge(7)
        .maxAge(11)
        .location("1945 SE Water Ave, Portland, OR 97214")
        .registrationUrl("https://campsunshine.example.com/register/lego");
  }

  public ExtractedRecordBuilder name(@Nullable String name) {
    this.name = name;
    return this;
  }

  public ExtractedRecordBuilder startDate(@Nullable String startDate) {
    this.startDate = startDate;
    return this;
  }

  public ExtractedRecordBuilder endDate(@Nullable String endDate) {
    this.endDate = endDate;
    return this;
  }

  public ExtractedRecordBuilder dateRaw(@Nullable String dateRaw) {
    this.dateRaw = dateRaw;
    return this;
  }

  public ExtractedRecordBuilder dropOffHour(@Nullable Integer dropOffHour) {
    this.dropOffHour = dropOffHour;
    return this;
  }

  public ExtractedRecordBuilder dropOffMinute(@Nullable Integer dropOffMinute) {
    this.dropOffMinute = dropOffMinute;
    return this;
  }

  public ExtractedRecordBuilder pickUpHour(@Nullable Integer pickUpHour) {
    this.pickUpHour = pickUpHour;
    return this;
  }

  public ExtractedRecordBuilder pickUpMinute(@Nullable Integer pickUpMinute) {
    this.pickUpMinute = pickUpMinute;
    return this;
  }

  public ExtractedRecordBuilder timeRaw(@Nullable String timeRaw) {
    this.timeRaw = timeRaw;
    return this;
  }

  public ExtractedRecordBuilder priceInCents(@Nullable Integer priceInCents) {
    this.priceInCents = priceInCents;
    return this;
  }

  public ExtractedRecordBuilder priceRaw(@Nullable String priceRaw) {
    this.priceRaw = priceRaw;
    return this;
  }

  public ExtractedRecordBuilder minAge(@Nullable Integer minAge) {
    this.minAge = minAge;
    return this;
  }

  public ExtractedRecordBuilder maxAge(@Nullable Integer maxAge) {
    this.maxAge = maxAge;
    return this;
  }

  public ExtractedRecordBuilder minGrade(@Nullable Integer minGrade) {
    this.minGrade = minGrade;
    return this;
  }

  public ExtractedRecordBuilder maxGrade(@Nullable Integer maxGrade) {
    this.maxGrade = maxGrade;
    return this;
  }

  public ExtractedRecordBuilder ageGradeRaw(@Nullable String ageGradeRaw) {
    this.ageGradeRaw = ageGradeRaw;
    return this;
  }

  public ExtractedRecordBuilder location(@Nullable String location) {
    this.location = location;
    return this;
  }

  public ExtractedRecordBuilder registrationUrl(@Nullable String registrationUrl) {
    this.registrationUrl = registrationUrl;
    return this;
  }

  public ExtractedRecordBuilder imageUrls(List<String> imageUrls) {
    this.imageUrls = imageUrls;
    return this;
  }

  public ExtractedRecordBuilder campName(@Nullable String campName) {
    this.campName = campName;
    return this;
  }

  public ExtractedRecordBuilder venue(ExtractedRecord.@Nullable Venue venue) {
    this.venue = venue;
    return this;
  }

  /** Clears both the structured age and grade bounds and the raw eligibility text. */
  public ExtractedRecordBuilder withoutAgeOrGrade() {
    this.minAge = null;
    this.maxAge = null;
    this.minGrade = null;
    this.maxGrade = null;
    this.ageGradeRaw = null;
    return this;
  }

  public ExtractedRecord build() {
    return new ExtractedRecord(
        name,
        startDate,
        endDate,
        dateRaw,
        dropOffHour,
        dropOffMinute,
        pickUpHour,
        pickUpMinute,
        timeRaw,
        priceInCents,
        priceRaw,
        minAge,
        maxAge,
        minGrade,
        maxGrade,
        ageGradeRaw,
        location,
        registrationUrl,
        imageUrls,
        campName,
        venue);
  }
}

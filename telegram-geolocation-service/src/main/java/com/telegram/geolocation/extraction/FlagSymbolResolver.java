package com.telegram.geolocation.extraction;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.telegram.geolocation.reference.CountryReferenceData;

/**
 * Maps flag symbols embedded in text to country codes.
 *
 * <p>Flags are reported in the iteration order of the reference mapping, not in the order they
 * appear in the text. When a message carries several flags the first one by mapping order is
 * authoritative.
 */
@Component
public class FlagSymbolResolver {

  private final CountryReferenceData referenceData;

  public FlagSymbolResolver(CountryReferenceData referenceData) {
    this.referenceData = referenceData;
  }

  /** Every country whose flag occurs in the text, in mapping order. */
  public List<String> findCountries(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    return referenceData.flagToCountry().entrySet().stream()
        .filter(entry -> text.contains(entry.getKey()))
        .map(Map.Entry::getValue)
        .toList();
  }

  /** The authoritative country code for the text, if any flag is present. */
  public Optional<String> resolve(String text) {
    return findCountries(text).stream().findFirst();
  }
}

package com.flamingo.ai.webmarkdown.model;

/**
 * Input for one page conversion.
 *
 * @param html already-rendered page markup (may be empty or malformed)
 * @param url URL the markup was fetched from, used for link resolution
 * @param filterOptions filter to apply; {@code null} means no filtering
 */
public record ConversionRequest(String html, String url, FilterOptions filterOptions) {

  public ConversionRequest {
    html = html != null ? html : "";
    url = url != null ? url : "";
    filterOptions = filterOptions != null ? filterOptions : FilterOptions.none();
  }
}

package com.qweather.sdk.api.air;

import java.util.List;

/**
 * Carried by every air quality response in place of the usual envelope fields.
 *
 * @param tag     opaque response identifier
 * @param sources data attributions, absent for some regions
 */
public record Metadata(String tag, List<String> sources) {
}

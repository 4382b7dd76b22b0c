package org.faultscan.stats;

import java.util.SortedMap;

public record LabelDistribution(SortedMap<String, Integer> groundTruth, SortedMap<String, Integer> predicted) {
}

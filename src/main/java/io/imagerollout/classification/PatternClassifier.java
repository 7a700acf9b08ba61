package io.imagerollout.classification;

import io.imagerollout.enums.UpdateStatus;

import java.util.regex.Pattern;

/**
 * Maps a disk image identifier to its update status.
 *
 * <p>The identifier is searched for the first match of each pattern (the pattern may match any part
 * of the identifier; anchor it with ^ and $ to require a full match). A missing identifier is UNKNOWN,
 * an identifier outside the image family is INELIGIBLE, and members of the family are either
 * UPDATE_COMPLETED (target version) or RESTART_REQUIRED (any other version).
 */
public class PatternClassifier {

    private final Pattern allVersionsPattern;
    private final Pattern targetVersionPattern;

    public PatternClassifier(String allVersionsPattern, String targetVersionPattern) {
        this(Pattern.compile(allVersionsPattern), Pattern.compile(targetVersionPattern));
    }

    public PatternClassifier(Pattern allVersionsPattern, Pattern targetVersionPattern) {
        if (allVersionsPattern == null || targetVersionPattern == null) {
            throw new IllegalArgumentException("Both image patterns are required");
        }
        this.allVersionsPattern = allVersionsPattern;
        this.targetVersionPattern = targetVersionPattern;
    }

    public UpdateStatus classify(String diskImageId) {
        return classify(diskImageId, allVersionsPattern, targetVersionPattern);
    }

    public static UpdateStatus classify(String diskImageId, Pattern allVersionsPattern, Pattern targetVersionPattern) {
        if (diskImageId == null || diskImageId.isBlank()) {
            return UpdateStatus.UNKNOWN;
        }
        if (!allVersionsPattern.matcher(diskImageId).find()) {
            return UpdateStatus.INELIGIBLE;
        }
        if (targetVersionPattern.matcher(diskImageId).find()) {
            return UpdateStatus.UPDATE_COMPLETED;
        }
        return UpdateStatus.RESTART_REQUIRED;
    }
}

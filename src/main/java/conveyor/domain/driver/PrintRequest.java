package conveyor.domain.driver;

import conveyor.dal.DriverProfile;

import java.nio.file.Path;

/**
 * Input of one print run
 *
 * @param jobId job being printed, used for logging
 * @param toolpath toolpath file to stream
 * @param profile resolved driver profile
 * @param buildName name shown on the printer
 */
public record PrintRequest(String jobId, Path toolpath, DriverProfile profile, String buildName) {
}

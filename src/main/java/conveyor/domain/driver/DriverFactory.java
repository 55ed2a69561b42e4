package conveyor.domain.driver;

import conveyor.dal.DriverProfile;

/**
 * Selects the driver implementation for a profile's backend
 */
public class DriverFactory {
    private final IPrinterDriver makerBot = new MakerBotDriver();
    private final IPrinterDriver dummy = new DummyDriver();

    public IPrinterDriver create(DriverProfile profile) {
        switch (profile.backend()) {
            case MAKERBOT:
                return makerBot;
            case DUMMY:
                return dummy;
            default:
                throw new IllegalArgumentException("Unsupported driver backend: " + profile.backend());
        }
    }
}

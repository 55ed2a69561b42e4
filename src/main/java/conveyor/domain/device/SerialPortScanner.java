package conveyor.domain.device;

import com.fazecast.jSerialComm.SerialPort;

import java.util.HashSet;
import java.util.Set;

/**
 * Port scanner backed by jSerialComm. Both the bare port name ({@code ttyACM0}, {@code COM3})
 * and the system path ({@code /dev/ttyACM0}) are reported, so either form can be configured.
 */
public class SerialPortScanner implements IPortScanner {

    @Override
    public Set<String> scan() {
        Set<String> ports = new HashSet<>();
        for (SerialPort port : SerialPort.getCommPorts()) {
            ports.add(port.getSystemPortName());
            ports.add(port.getSystemPortPath());
        }
        return ports;
    }
}

package nl.infomedics.perio.cli;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor @Getter
public class Command {
    private final CommandType type;
    private final List<String> values;

    public String value(int index) {
        return values.get(index);
    }
}

package nl.infomedics.perio;

import java.util.Optional;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import lombok.extern.slf4j.Slf4j;
import nl.infomedics.perio.cli.Command;
import nl.infomedics.perio.cli.CommandExecutor;
import nl.infomedics.perio.cli.CommandTranslator;
import nl.infomedics.perio.config.RecordsProperties;
import nl.infomedics.perio.error.ValidationException;
import nl.infomedics.perio.service.PatientService;

@Slf4j
@SpringBootApplication
public class PerioRecorderApplication implements CommandLineRunner {

    private final CommandTranslator translator;
    private final CommandExecutor executor;
    private final PatientService patientService;
    private final RecordsProperties properties;

    public PerioRecorderApplication(CommandTranslator translator, CommandExecutor executor,
                                    PatientService patientService, RecordsProperties properties) {
        this.translator = translator;
        this.executor = executor;
        this.patientService = patientService;
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication.run(PerioRecorderApplication.class, args);
    }

    @Override
    public void run(String... args) throws Exception {
        log.info("Records file: {}", properties.getPath());
        Optional<Command> command;
        String output;
        try {
            command = translator.translate(args);
            if (command.isEmpty()) {
                log.info("No option given, nothing to do. {}", translator.usage());
                return;
            }
            log.debug("Running {} {}", command.get().getType(), command.get().getValues());
            output = executor.execute(command.get());
        } catch (ValidationException e) {
            log.error("Invalid input for '{}': {}", e.getField(), e.getMessage());
            return;
        }
        System.out.println(output);
        if (command.get().getType().isMutating()) {
            patientService.save();
        }
    }
}

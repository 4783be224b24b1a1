package de.ialistannen.searchlight.cli;

import java.util.List;
import java.util.Optional;
import net.jbock.Command;
import net.jbock.Option;

@Command(
  name = "searchlight",
  description = "Scans the images of deployed Cloud Run services for vulnerabilities",
  publicParser = true
)
public interface CliArguments {

  @Option(
    names = "--event",
    description = "File containing the event envelope. Default: read it from stdin",
    paramLabel = "PATH"
  )
  Optional<String> eventFile();

  @Option(
    names = "--image",
    description = "Scan this image instead of handling an event. Can be given more than once",
    paramLabel = "IMAGE"
  )
  List<String> images();

  @Option(names = "--force", description = "Scan images even if they were scanned recently. Default: false")
  boolean force();
}

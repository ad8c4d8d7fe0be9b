package com.foo.pareto.service.pipeline.discover;

import com.foo.pareto.exception.InputFilesNotFoundException;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class InputFileLocator {

  /**
   * Lists the regular files in {@code directory} matching the glob {@code filePattern}, sorted
   * by file name.
   *
   * @throws InputFilesNotFoundException if the directory is missing, unreadable or has no match
   */
  public List<Path> locate(Path directory, String filePattern) {
    if (!Files.isDirectory(directory)) {
      throw new InputFilesNotFoundException(directory, filePattern);
    }

    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, filePattern)) {
      for (Path entry : stream) {
        if (Files.isRegularFile(entry)) {
          files.add(entry);
        }
      }
    } catch (IOException e) {
      throw new InputFilesNotFoundException(directory, filePattern, e);
    }

    if (files.isEmpty()) {
      throw new InputFilesNotFoundException(directory, filePattern);
    }

    files.sort(Comparator.comparing(p -> p.getFileName().toString()));
    log.info("Found {} input file(s) in {}", files.size(), directory);
    return files;
  }
}

package com.foo.pareto.runner;

import com.foo.pareto.exception.ColumnNormalizationException;
import com.foo.pareto.exception.InputFilesNotFoundException;
import com.foo.pareto.exception.NoPositiveSalesException;
import com.foo.pareto.exception.NoSalesDataException;
import org.springframework.boot.ExitCodeExceptionMapper;
import org.springframework.stereotype.Component;

/** Maps fatal pipeline errors to process exit codes so schedulers can tell them apart. */
@Component
public class PipelineExitCodeMapper implements ExitCodeExceptionMapper {

  public static final int GENERIC_FAILURE = 1;
  public static final int NO_INPUT_FILES = 2;
  public static final int NO_SALES_DATA = 3;
  public static final int NO_POSITIVE_SALES = 4;
  public static final int MISSING_COLUMN = 5;

  @Override
  public int getExitCode(Throwable exception) {
    // ApplicationRunner failures arrive wrapped
    for (Throwable t = exception; t != null; t = t.getCause()) {
      if (t instanceof InputFilesNotFoundException) {
        return NO_INPUT_FILES;
      }
      if (t instanceof NoSalesDataException) {
        return NO_SALES_DATA;
      }
      if (t instanceof NoPositiveSalesException) {
        return NO_POSITIVE_SALES;
      }
      if (t instanceof ColumnNormalizationException) {
        return MISSING_COLUMN;
      }
    }
    return GENERIC_FAILURE;
  }
}

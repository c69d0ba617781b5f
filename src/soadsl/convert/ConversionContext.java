package soadsl.convert;

import soadsl.expr.ExpressionEvaluator;
import soadsl.library.DeviceLibrary;
import soadsl.library.MonitorLibrary;
import soadsl.model.GlobalConfig;

/**
 * Lookup state of one {@link UniversalConverter#convert} call.
 */
public record ConversionContext(GlobalConfig global, ExpressionEvaluator evaluator, DeviceLibrary devices, MonitorLibrary monitors) {

  public static ConversionContext of(GlobalConfig global, DeviceLibrary devices, MonitorLibrary monitors) {
    return new ConversionContext(global, new ExpressionEvaluator(global.globalParameters()), devices, monitors);
  }
}

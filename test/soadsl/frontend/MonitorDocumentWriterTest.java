package soadsl.frontend;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import soadsl.model.MonitorDocument;

class MonitorDocumentWriterTest {

  private final SpecParser parser = new SpecParser();
  private final MonitorDocumentWriter writer = new MonitorDocumentWriter();

  @Test
  void testRoundTrip() throws SpecParseException {
    MonitorDocument doc = parser.parseMonitor(SpecParserTest.MONITOR_YAML);
    String yaml = writer.write(doc);
    MonitorDocument reread = parser.parseMonitor(yaml);

    Assertions.assertEquals(doc.getVersion(), reread.getVersion());
    Assertions.assertEquals(doc.getProcess(), reread.getProcess());
    Assertions.assertEquals(doc.getDate(), reread.getDate());
    Assertions.assertEquals(doc.getGlobal(), reread.getGlobal());
    Assertions.assertEquals(doc.getParameters(), reread.getParameters());
    Assertions.assertEquals(doc.getMonitors(), reread.getMonitors());
    Assertions.assertEquals(yaml, writer.write(reread));
  }

  @Test
  @SuppressWarnings("unchecked")
  void testTreeLayout() throws SpecParseException {
    Map<String, Object> tree = writer.toYamlTree(parser.parseMonitor(SpecParserTest.MONITOR_YAML));
    Assertions.assertEquals(List.of("version", "process", "date", "global", "parameters", "monitors"), List.copyOf(tree.keySet()));
    Map<String, Object> first = ((List<Map<String, Object>>)tree.get("monitors")).get(0);
    Assertions.assertEquals("ovcheck", first.get("monitor_type"));
    Map<String, Object> params = (Map<String, Object>)first.get("parameters");
    Assertions.assertEquals(List.of("tmin", "tdelay", "vballmsg", "stop", "tmaxfrac", "branch1", "message1", "vlow", "vhigh", "severity"),
                            List.copyOf(params.keySet()));
    Assertions.assertEquals("vmax", params.get("vhigh"));
  }
}

package soadsl.util;

/**
 * Spectre netlist dialect.
 */
public class Spectre extends GenerateText {

  public Spectre() {
    // initialize dictionary
    DictionaryDefinition();
  }

  private void DictionaryDefinition() {
    dictionary.put(DictWords.simulator_lang, "simulator lang=spectre");
    dictionary.put(DictWords.comment, "//");
    dictionary.put(DictWords.section, "section");
    dictionary.put(DictWords.endsection, "endsection");
    dictionary.put(DictWords.include, "ahdl_include");
    dictionary.put(DictWords.parameters, "parameters");
    dictionary.put(DictWords.model, "model");
    dictionary.put(DictWords.continuation, "+");
    dictionary.put(DictWords.assign_eq, "=");
    dictionary.put(DictWords.quote, "\"");
  }

  public String Section(String name) { return GetDict(DictWords.section) + " " + name; }

  public String EndSection(String name) { return GetDict(DictWords.endsection) + " " + name; }

  public String Include(String path) { return GetDict(DictWords.include) + " " + Quote(path); }

  public String Model(String name, String kind) { return GetDict(DictWords.model) + " " + name + " " + kind; }
}

package com.typeresolve.engine.ingest;

import com.typeresolve.engine.dynamic.DynamicBinding;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class BindingsReader {

    /**
     * Reads bindings.json. A binding without {@code literal_value} is kept as a
     * computed (non-static) binding; one without {@code site_id} gets a positional id.
     *
     * @throws GraphReadException if the file is missing or malformed, or a binding has no key
     */
    public List<DynamicBinding> read(Path bindingsPath) {
        BindingsDocument document = JsonFileReader.read(
                bindingsPath, BindingsDocument.class, "Bindings file", GraphReadException::new);

        List<DynamicBinding> result = new ArrayList<>();
        int index = 0;
        for (BindingsDocument.BindingDoc doc : document.getBindings()) {
            index++;
            if (doc == null || doc.key == null || doc.key.isBlank()) {
                throw new GraphReadException("Binding #" + index + " in " + bindingsPath + " has no key");
            }
            String siteId = doc.siteId != null ? doc.siteId : "binding#" + index;
            result.add(new DynamicBinding(doc.key, doc.literalValue, siteId));
        }
        return result;
    }
}

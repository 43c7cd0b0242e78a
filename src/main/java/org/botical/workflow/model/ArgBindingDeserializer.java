/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.botical.workflow.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Reads {@link ArgBinding}s, treating anything that is not a tagged binding object as a literal.
 */
class ArgBindingDeserializer extends StdDeserializer<ArgBinding> {

    ArgBindingDeserializer() {
        super(ArgBinding.class);
    }

    @Override
    public ArgBinding deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);

        if (node.isObject() && node.path("type").isTextual()) {
            switch (node.get("type").asText()) {
                case "literal":
                    return new ArgBinding.Literal(toValue(node.get("value"), parser));
                case "input":
                    return new ArgBinding.Input(textOrNull(node.get("path")));
                case "step":
                    String stepId = textOrNull(node.get("stepId"));
                    if (stepId == null) {
                        return ctxt.reportInputMismatch(ArgBinding.class, "step binding requires 'stepId'");
                    }
                    return new ArgBinding.StepOutput(stepId, textOrNull(node.get("path")));
                default:
                    break;
            }
        }
        return new ArgBinding.Literal(toValue(node, parser));
    }

    private static Object toValue(JsonNode node, JsonParser parser) throws IOException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return parser.getCodec().treeToValue(node, Object.class);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}

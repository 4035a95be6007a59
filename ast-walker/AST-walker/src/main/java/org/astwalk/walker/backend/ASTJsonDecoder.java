package org.astwalk.walker.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.astwalk.ir.ASTExpr;
import org.astwalk.ir.ASTKind;
import org.astwalk.ir.ASTOpaqueUnit;
import org.astwalk.ir.ASTTuple;
import org.astwalk.ir.ASTType;
import org.astwalk.ir.IASTNode;
import org.astwalk.ir.leaf.ASTBoolLiteral;
import org.astwalk.ir.leaf.ASTDoubleLiteral;
import org.astwalk.ir.leaf.ASTFieldRef;
import org.astwalk.ir.leaf.ASTGlobalRef;
import org.astwalk.ir.leaf.ASTGoto;
import org.astwalk.ir.leaf.ASTIntLiteral;
import org.astwalk.ir.leaf.ASTLabel;
import org.astwalk.ir.leaf.ASTLineNumber;
import org.astwalk.ir.leaf.ASTNewVar;
import org.astwalk.ir.leaf.ASTNothing;
import org.astwalk.ir.leaf.ASTQuote;
import org.astwalk.ir.leaf.ASTStringLiteral;
import org.astwalk.ir.leaf.ASTSymbol;
import org.astwalk.ir.leaf.ASTTempSymbol;
import org.astwalk.ir.leaf.ASTTopRef;
import org.astwalk.ir.leaf.ASTTypeRef;
import org.astwalk.ir.leaf.ASTTypedSymbol;
import org.astwalk.util.Utilities;
import org.astwalk.walker.errors.InputError;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Deserialize trees produced by {@link IASTNode#asJson()}. */
public class ASTJsonDecoder {
    final ObjectMapper mapper;

    public ASTJsonDecoder() {
        this.mapper = Utilities.deterministicObjectMapper();
    }

    public IASTNode decode(String json) {
        try {
            JsonNode node = this.mapper.readTree(json);
            return this.decode(node);
        } catch (JsonProcessingException ex) {
            throw new InputError("Could not parse JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    public IASTNode decode(JsonNode node) {
        if (!node.isObject())
            throw new InputError("Expected a JSON object, got " + Utilities.toDepth(node, 80));
        String cls = Utilities.getStringProperty(node, "class");
        return switch (cls) {
            case "ASTExpr" -> this.decodeExpr(node);
            case "ASTTuple" -> new ASTTuple(
                    this.decodeList(Utilities.getProperty(node, "elements")),
                    new ASTType(Utilities.getStringProperty(node, "type")));
            case "ASTOpaqueUnit" -> new ASTOpaqueUnit(Utilities.getStringProperty(node, "payload"));
            case "ASTSymbol" -> new ASTSymbol(Utilities.getStringProperty(node, "name"));
            case "ASTTopRef" -> new ASTTopRef(Utilities.getStringProperty(node, "name"));
            case "ASTNewVar" -> new ASTNewVar(Utilities.getStringProperty(node, "name"));
            case "ASTQuote" -> new ASTQuote(Utilities.getStringProperty(node, "value"));
            case "ASTTypedSymbol" -> new ASTTypedSymbol(
                    Utilities.getStringProperty(node, "name"),
                    new ASTType(Utilities.getStringProperty(node, "type")));
            case "ASTTempSymbol" -> new ASTTempSymbol(Utilities.getIntProperty(node, "id"));
            case "ASTGlobalRef" -> new ASTGlobalRef(
                    Utilities.getStringProperty(node, "module"),
                    Utilities.getStringProperty(node, "name"));
            case "ASTFieldRef" -> new ASTFieldRef(
                    Utilities.getStringProperty(node, "value"),
                    Utilities.getStringProperty(node, "field"));
            case "ASTLineNumber" -> new ASTLineNumber(
                    Utilities.getIntProperty(node, "line"),
                    Utilities.getOptionalStringProperty(node, "file"));
            case "ASTLabel" -> new ASTLabel(Utilities.getIntProperty(node, "label"));
            case "ASTGoto" -> new ASTGoto(Utilities.getIntProperty(node, "label"));
            case "ASTNothing" -> ASTNothing.INSTANCE;
            case "ASTTypeRef" -> new ASTTypeRef(new ASTType(Utilities.getStringProperty(node, "type")));
            case "ASTIntLiteral" -> new ASTIntLiteral(Utilities.getLongProperty(node, "value"));
            case "ASTDoubleLiteral" -> new ASTDoubleLiteral(Utilities.getProperty(node, "value").asDouble());
            case "ASTBoolLiteral" -> ASTBoolLiteral.of(Utilities.getBooleanProperty(node, "value"));
            case "ASTStringLiteral" -> new ASTStringLiteral(Utilities.getStringProperty(node, "value"));
            default -> throw new InputError("Unknown node class " + Utilities.singleQuote(cls));
        };
    }

    ASTExpr decodeExpr(JsonNode node) {
        String kindName = Utilities.getStringProperty(node, "kind");
        ASTKind kind = ASTKind.fromText(kindName);
        if (kind == null)
            throw new InputError("Unknown node kind " + Utilities.singleQuote(kindName));
        @Nullable String type = Utilities.getOptionalStringProperty(node, "type");
        List<IASTNode> children = this.decodeList(Utilities.getProperty(node, "children"));
        return new ASTExpr(kind, children, type == null ? null : new ASTType(type));
    }

    List<IASTNode> decodeList(JsonNode array) {
        if (!array.isArray())
            throw new InputError("Expected a JSON array, got " + Utilities.toDepth(array, 80));
        List<IASTNode> result = new ArrayList<>(array.size());
        for (JsonNode element: array)
            result.add(this.decode(element));
        return result;
    }
}

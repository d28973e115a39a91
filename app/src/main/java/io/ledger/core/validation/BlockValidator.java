package io.ledger.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.ledger.core.protocol.Block;
import io.ledger.core.protocol.ErrorKind;
import io.ledger.core.protocol.Input;
import io.ledger.core.protocol.LedgerError;
import io.ledger.core.protocol.Output;
import io.ledger.core.protocol.Transaction;
import io.ledger.core.protocol.ValidationResult;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks on untrusted JSON, run before anything touches the ledger.
 *
 * Every method is pure: it either projects the node onto the typed protocol model or returns a
 * STRUCTURAL error naming the offending field. No ledger state is consulted here; sequencing,
 * identity and spend checks belong to the engine.
 */
public final class BlockValidator {
    private BlockValidator() {}

    public static ValidationResult<Block> validateBlock(JsonNode data) {
        if (data == null || !data.isObject()) {
            return fail("Invalid block data");
        }
        String id = nonEmptyText(data.get("id"));
        if (id == null) {
            return fail("Block id must be a non-empty string");
        }
        JsonNode heightNode = data.get("height");
        if (!isIntegral(heightNode) || !heightNode.canConvertToLong() || heightNode.longValue() < 1) {
            return fail("Block height must be an integer >= 1");
        }
        JsonNode txsNode = data.get("transactions");
        if (txsNode == null || !txsNode.isArray()) {
            return fail("Block transactions must be an array");
        }

        List<Transaction> transactions = new ArrayList<>(txsNode.size());
        for (int i = 0; i < txsNode.size(); i++) {
            ValidationResult<Transaction> tx = validateTransaction(txsNode.get(i), "transactions[" + i + "]");
            if (!tx.ok) {
                return tx.asError();
            }
            transactions.add(tx.value);
        }
        return ValidationResult.ok(new Block(id, heightNode.longValue(), transactions));
    }

    public static ValidationResult<Transaction> validateTransaction(JsonNode data) {
        return validateTransaction(data, "transaction");
    }

    public static ValidationResult<Input> validateInput(JsonNode data) {
        return validateInput(data, "input");
    }

    public static ValidationResult<Output> validateOutput(JsonNode data) {
        return validateOutput(data, "output");
    }

    /**
     * Rollback targets arrive as a query string or a JSON number. Accepts a decimal integer
     * string (surrounding whitespace ignored) or an integral number; anything else, and any
     * negative value, is rejected.
     */
    public static ValidationResult<Long> validateRollbackHeight(Object height) {
        Long parsed = null;
        if (height instanceof JsonNode node) {
            if (node.isTextual()) {
                parsed = parseLong(node.textValue());
            } else if (isIntegral(node) && node.canConvertToLong()) {
                parsed = node.longValue();
            }
        } else if (height instanceof String text) {
            parsed = parseLong(text);
        } else if (height instanceof Long || height instanceof Integer) {
            parsed = ((Number) height).longValue();
        }
        if (parsed == null || parsed < 0) {
            return ValidationResult.error(new LedgerError(
                    ErrorKind.STRUCTURAL,
                    LedgerError.INVALID_HEIGHT,
                    "Invalid height parameter"));
        }
        return ValidationResult.ok(parsed);
    }

    private static ValidationResult<Transaction> validateTransaction(JsonNode data, String path) {
        if (data == null || !data.isObject()) {
            return fail("Invalid transaction data at " + path);
        }
        String id = nonEmptyText(data.get("id"));
        if (id == null) {
            return fail(path + ".id must be a non-empty string");
        }
        JsonNode inputsNode = data.get("inputs");
        if (inputsNode == null || !inputsNode.isArray()) {
            return fail(path + ".inputs must be an array");
        }
        JsonNode outputsNode = data.get("outputs");
        if (outputsNode == null || !outputsNode.isArray()) {
            return fail(path + ".outputs must be an array");
        }

        List<Input> inputs = new ArrayList<>(inputsNode.size());
        for (int i = 0; i < inputsNode.size(); i++) {
            ValidationResult<Input> input = validateInput(inputsNode.get(i), path + ".inputs[" + i + "]");
            if (!input.ok) {
                return input.asError();
            }
            inputs.add(input.value);
        }
        List<Output> outputs = new ArrayList<>(outputsNode.size());
        for (int i = 0; i < outputsNode.size(); i++) {
            ValidationResult<Output> output = validateOutput(outputsNode.get(i), path + ".outputs[" + i + "]");
            if (!output.ok) {
                return output.asError();
            }
            outputs.add(output.value);
        }
        return ValidationResult.ok(new Transaction(id, inputs, outputs));
    }

    private static ValidationResult<Input> validateInput(JsonNode data, String path) {
        if (data == null || !data.isObject()) {
            return fail("Invalid input data at " + path);
        }
        String txId = nonEmptyText(data.get("txId"));
        if (txId == null) {
            return fail(path + ".txId must be a non-empty string");
        }
        JsonNode indexNode = data.get("index");
        if (!isIntegral(indexNode) || !indexNode.canConvertToInt() || indexNode.intValue() < 0) {
            return fail(path + ".index must be an integer >= 0");
        }
        return ValidationResult.ok(new Input(txId, indexNode.intValue()));
    }

    private static ValidationResult<Output> validateOutput(JsonNode data, String path) {
        if (data == null || !data.isObject()) {
            return fail("Invalid output data at " + path);
        }
        String address = nonEmptyText(data.get("address"));
        if (address == null) {
            return fail(path + ".address must be a non-empty string");
        }
        JsonNode valueNode = data.get("value");
        if (valueNode == null || !valueNode.isNumber()) {
            return fail(path + ".value must be a number >= 0");
        }
        BigDecimal value = valueNode.decimalValue();
        if (value.signum() < 0) {
            return fail(path + ".value must be a number >= 0");
        }
        if (!Output.isValidValue(value)) {
            return fail(path + ".value is out of range (at most " + Output.MAX_INTEGER_DIGITS
                    + " integer and " + Output.MAX_SCALE + " fractional digits)");
        }
        return ValidationResult.ok(new Output(address, value));
    }

    private static String nonEmptyText(JsonNode node) {
        if (node == null || !node.isTextual() || node.textValue().isEmpty()) {
            return null;
        }
        return node.textValue();
    }

    private static boolean isIntegral(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return false;
        }
        return node.isIntegralNumber() || node.canConvertToExactIntegral();
    }

    private static Long parseLong(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Long.parseLong(text.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static <T> ValidationResult<T> fail(String message) {
        return ValidationResult.error(LedgerError.structural(message));
    }
}

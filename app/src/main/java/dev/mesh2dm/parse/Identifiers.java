package dev.mesh2dm.parse;

final class Identifiers {

    private Identifiers() {
    }

    static long parse(String field, String entity, boolean allowZeroIndex) {
        long id = NumericLiterals.toInteger(field);
        if (id <= 0 && !(id == 0 && allowZeroIndex)) {
            throw new InvalidIdentifierException(entity, id);
        }
        return id;
    }
}

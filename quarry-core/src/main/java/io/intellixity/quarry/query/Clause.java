package io.intellixity.quarry.query;

public enum Clause {
  AND,
  OR
}

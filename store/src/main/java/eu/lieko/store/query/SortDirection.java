package eu.lieko.store.query;

public enum SortDirection {
    ASC,
    DESC
}

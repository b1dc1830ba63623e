package com.pulselang.compiler.ast;

/**
 * 类型引用：基础类型名或类名，加可选的数组维度
 */
public final class TypeRef {
    private final String name;
    private final int arrayDimensions;

    public static final TypeRef VOID = new TypeRef("void", 0);

    public TypeRef(String name, int arrayDimensions) {
        this.name = name;
        this.arrayDimensions = arrayDimensions;
    }

    public static TypeRef of(String name) {
        return new TypeRef(name, 0);
    }

    public String getName() {
        return name;
    }

    public int getArrayDimensions() {
        return arrayDimensions;
    }

    public boolean isArray() {
        return arrayDimensions > 0;
    }

    public boolean isVoid() {
        return arrayDimensions == 0 && "void".equals(name);
    }

    /** 去掉一层数组维度后的类型 */
    public TypeRef elementType() {
        return arrayDimensions > 0 ? new TypeRef(name, arrayDimensions - 1) : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeRef)) return false;
        TypeRef other = (TypeRef) o;
        return arrayDimensions == other.arrayDimensions && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + arrayDimensions;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name);
        for (int i = 0; i < arrayDimensions; i++) {
            sb.append("[]");
        }
        return sb.toString();
    }
}

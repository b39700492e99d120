package com.babeltest.core.resolve;

/**
 * Where a collaborator lives, found without constructing anything. Either a module
 * function ({@code type == null}) or a method of a registered type.
 *
 * @param module     module the function or type is registered in
 * @param ownerPath  dotted path of the module or the type
 * @param memberName Java name of the function or method
 * @param type       the registered type, for methods
 */
public record TargetLocation(TargetModule module, String ownerPath, String memberName, Class<?> type) {

    public boolean isFunction() {
        return type == null;
    }

    public String overrideKey() {
        return MethodOverrides.key(ownerPath, memberName);
    }

    public String path() {
        return ownerPath + "." + memberName;
    }
}

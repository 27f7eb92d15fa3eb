package info.isaksson.erland.metatree.binding;

/** A binding refused a tree edit that would not be expressible in its language. */
public class MutationRejectedException extends MetaTreeException {

    public MutationRejectedException(String message) {
        super(message);
    }
}
